package com.fintech.ticks.feed;

import com.fintech.ticks.domain.Trade;

import java.util.List;

/**
 * One decoded frame of the upstream trade feed. The frame kind is resolved once, in
 * {@link FeedMessageDecoder}; everything past the decoder works on these types.
 */
public sealed interface FeedMessage permits FeedMessage.TradeBatch, FeedMessage.FeedError, FeedMessage.KeepAlive {

    /**
     * Trades delivered in a single frame, in frame order.
     */
    record TradeBatch(List<Trade> trades) implements FeedMessage {

        public TradeBatch {
            trades = List.copyOf(trades);
        }
    }

    /**
     * Error payload reported by the feed.
     */
    record FeedError(String message) implements FeedMessage {
    }

    /**
     * Keep-alive probe. Carries no data.
     */
    record KeepAlive() implements FeedMessage {
    }
}
