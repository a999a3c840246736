package com.fintech.ticks.feed;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subscription frame sent once per tracked symbol after the connection opens:
 * {@code {"type":"subscribe","symbol":"AAPL"}}.
 */
public record SubscribeRequest(
    @JsonProperty("type") String type,
    @JsonProperty("symbol") String symbol
) {

    public static SubscribeRequest of(String symbol) {
        return new SubscribeRequest("subscribe", symbol);
    }
}
