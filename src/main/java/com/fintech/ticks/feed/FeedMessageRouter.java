package com.fintech.ticks.feed;

import com.fintech.ticks.domain.Trade;
import com.fintech.ticks.ingestion.TickIngestionPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for raw feed frames. Decodes each frame and routes it: trades into the
 * ingestion ring buffer, errors to the log, keep-alives acknowledged.
 *
 * <p>Never throws for a bad frame; protocol problems are logged and counted.
 */
@Component
public class FeedMessageRouter {

    private static final Logger log = LoggerFactory.getLogger(FeedMessageRouter.class);

    private final FeedMessageDecoder decoder;
    private final TickIngestionPublisher publisher;

    private final AtomicLong tradesRouted = new AtomicLong(0);
    private final AtomicLong feedErrors = new AtomicLong(0);
    private final AtomicLong keepAlives = new AtomicLong(0);
    private final AtomicLong protocolErrors = new AtomicLong(0);

    public FeedMessageRouter(FeedMessageDecoder decoder, TickIngestionPublisher publisher, MeterRegistry meterRegistry) {
        this.decoder = decoder;
        this.publisher = publisher;

        meterRegistry.gauge("ticks.feed.trades", tradesRouted);
        meterRegistry.gauge("ticks.feed.errors", feedErrors);
        meterRegistry.gauge("ticks.feed.keepalives", keepAlives);
        meterRegistry.gauge("ticks.feed.protocol.errors", protocolErrors);
    }

    /**
     * Decodes and routes one frame.
     *
     * @return the decoded message, or null if the frame could not be decoded
     */
    public FeedMessage onFrame(String frame) {
        FeedMessage message;
        try {
            message = decoder.decode(frame);
        } catch (FeedProtocolException e) {
            protocolErrors.incrementAndGet();
            log.warn("Undecodable feed frame: {} ({})", e.getMessage(), e.getFrame());
            return null;
        }
        route(message);
        return message;
    }

    /**
     * Routes an already-decoded message.
     */
    public void route(FeedMessage message) {
        if (message instanceof FeedMessage.TradeBatch batch) {
            for (Trade trade : batch.trades()) {
                publisher.publish(trade);
            }
            tradesRouted.addAndGet(batch.trades().size());
            log.debug("Routed trade batch: trades={}", batch.trades().size());
        } else if (message instanceof FeedMessage.FeedError error) {
            feedErrors.incrementAndGet();
            log.warn("Feed reported error: {}", error.message());
        } else if (message instanceof FeedMessage.KeepAlive) {
            keepAlives.incrementAndGet();
            log.debug("Feed keep-alive received");
        }
    }

    public long getTradesRouted() {
        return tradesRouted.get();
    }

    public long getFeedErrors() {
        return feedErrors.get();
    }

    public long getKeepAlives() {
        return keepAlives.get();
    }

    public long getProtocolErrors() {
        return protocolErrors.get();
    }
}
