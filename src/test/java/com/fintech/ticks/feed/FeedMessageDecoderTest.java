package com.fintech.ticks.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.ticks.domain.Trade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FeedMessageDecoder Tests")
class FeedMessageDecoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FeedMessageDecoder decoder = new FeedMessageDecoder(objectMapper);

    @Test
    @DisplayName("Should decode a trade batch for several symbols")
    void testTradeBatch() {
        String frame = """
            {"type":"trade","data":[
              {"s":"BINANCE:BTCUSDT","p":43125.5,"t":1705312800123,"v":0.01,"c":null},
              {"s":"AAPL","p":172,"t":1705312800456,"v":100,"c":["1","12"]}
            ]}
            """;

        FeedMessage message = decoder.decode(frame);

        assertThat(message).isInstanceOf(FeedMessage.TradeBatch.class);
        assertThat(((FeedMessage.TradeBatch) message).trades()).containsExactly(
            new Trade("BINANCE:BTCUSDT", 43125.5, 1705312800123L),
            new Trade("AAPL", 172.0, 1705312800456L)
        );
    }

    @Test
    @DisplayName("Empty data array is an empty batch")
    void testEmptyBatch() {
        FeedMessage message = decoder.decode("{\"type\":\"trade\",\"data\":[]}");

        assertThat(((FeedMessage.TradeBatch) message).trades()).isEmpty();
    }

    @Test
    @DisplayName("Should decode a keep-alive")
    void testPing() {
        assertThat(decoder.decode("{\"type\":\"ping\"}")).isInstanceOf(FeedMessage.KeepAlive.class);
    }

    @Test
    @DisplayName("Should decode typed and bare error payloads")
    void testErrors() {
        assertThat(decoder.decode("{\"type\":\"error\",\"msg\":\"Invalid symbol\"}"))
            .isEqualTo(new FeedMessage.FeedError("Invalid symbol"));
        assertThat(decoder.decode("{\"msg\":\"You don't have access to this resource.\"}"))
            .isEqualTo(new FeedMessage.FeedError("You don't have access to this resource."));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "not json",
        "[1,2,3]",
        "{\"type\":\"news\"}",
        "{}",
        "{\"type\":\"trade\"}",
        "{\"type\":\"trade\",\"data\":[{\"s\":\"AAPL\",\"t\":1}]}",
        "{\"type\":\"trade\",\"data\":[{\"s\":\"AAPL\",\"p\":\"high\",\"t\":1}]}"
    })
    @DisplayName("Should reject unknown shapes")
    void testProtocolErrors(String frame) {
        assertThatThrownBy(() -> decoder.decode(frame))
            .isInstanceOfSatisfying(FeedProtocolException.class,
                e -> assertThat(e.getFrame()).isEqualTo(frame));
    }

    @Test
    @DisplayName("Subscribe request serializes to the feed's shape")
    void testSubscribeRequest() throws Exception {
        String json = objectMapper.writeValueAsString(SubscribeRequest.of("BINANCE:BTCUSDT"));

        assertThat(objectMapper.readTree(json))
            .isEqualTo(objectMapper.readTree("{\"type\":\"subscribe\",\"symbol\":\"BINANCE:BTCUSDT\"}"));
    }
}
