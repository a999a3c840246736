package com.fintech.ticks.symbol;

/**
 * A timestamp was sent into a signal channel that has already been closed.
 */
public class SignalChannelClosedException extends RuntimeException {

    public SignalChannelClosedException(String channelName) {
        super("Signal channel is closed: " + channelName);
    }
}
