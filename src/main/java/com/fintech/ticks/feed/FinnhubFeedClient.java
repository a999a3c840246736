package com.fintech.ticks.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.ticks.config.TickProperties;
import com.fintech.ticks.symbol.SymbolRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WebSocket connection to the Finnhub trade feed. Connects once at startup, subscribes
 * every tracked symbol, and hands each text frame to the {@link FeedMessageRouter}.
 * There is no reconnect: a dropped connection stays dropped.
 */
@Component
@ConditionalOnProperty(name = "ticks.feed.enabled", havingValue = "true")
public class FinnhubFeedClient extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(FinnhubFeedClient.class);
    private static final long CONNECT_TIMEOUT_SECONDS = 30;

    private final TickProperties properties;
    private final SymbolRegistry registry;
    private final FeedMessageRouter router;
    private final ObjectMapper objectMapper;
    private final StandardWebSocketClient client = new StandardWebSocketClient();

    private volatile WebSocketSession session;

    public FinnhubFeedClient(TickProperties properties, SymbolRegistry registry,
                             FeedMessageRouter router, ObjectMapper objectMapper) {
        this.properties = properties;
        this.registry = registry;
        this.router = router;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void connect() {
        URI uri = feedUri();
        log.info("Connecting to trade feed: {}", properties.getFeed().getUrl());
        try {
            session = client.execute(this, new WebSocketHttpHeaders(), uri)
                .get(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while connecting to trade feed", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Cannot connect to trade feed at " + properties.getFeed().getUrl(), e);
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        for (String symbol : registry.symbols()) {
            session.sendMessage(new TextMessage(encode(SubscribeRequest.of(symbol))));
        }
        log.info("Trade feed connected, subscribed: {}", registry.symbols());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        FeedMessage decoded = router.onFrame(message.getPayload());
        if (decoded instanceof FeedMessage.KeepAlive && session.isOpen()) {
            session.sendMessage(new PongMessage(ByteBuffer.allocate(0)));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Trade feed transport error: {}", exception.getMessage(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.warn("Trade feed connection closed: {}", status);
    }

    @PreDestroy
    public void disconnect() throws IOException {
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            current.close(CloseStatus.NORMAL);
            log.info("Trade feed disconnected");
        }
    }

    private URI feedUri() {
        String token = properties.getFeed().getToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("ticks.feed.token must be set when ticks.feed.enabled=true");
        }
        return UriComponentsBuilder.fromUriString(properties.getFeed().getUrl())
            .queryParam("token", token)
            .build()
            .toUri();
    }

    private String encode(SubscribeRequest request) throws JsonProcessingException {
        return objectMapper.writeValueAsString(request);
    }
}
