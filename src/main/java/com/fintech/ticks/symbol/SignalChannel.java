package com.fintech.ticks.symbol;

import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded single-value-per-send channel carrying minute-boundary timestamps from the
 * dispatcher to one worker. Sends never drop; a slow receiver only lets values queue up.
 */
public class SignalChannel {

    // Empty value marks the end of the stream
    private static final OptionalLong CLOSED = OptionalLong.empty();

    private final String name;
    private final BlockingQueue<OptionalLong> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    public SignalChannel(String name) {
        this.name = name;
    }

    /**
     * Enqueues one timestamp.
     *
     * @throws SignalChannelClosedException if the channel has been closed
     */
    public void send(long timestamp) {
        if (closed) {
            throw new SignalChannelClosedException(name);
        }
        queue.add(OptionalLong.of(timestamp));
    }

    /**
     * Blocks until a timestamp is available.
     *
     * @return the next timestamp, or empty once the channel is closed and drained
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public OptionalLong receive() throws InterruptedException {
        OptionalLong value = queue.take();
        if (!value.isPresent()) {
            // Keep the marker for any other receiver
            queue.add(CLOSED);
        }
        return value;
    }

    /**
     * Rejects further sends and wakes the receiver once queued values are drained.
     */
    public void close() {
        if (!closed) {
            closed = true;
            queue.add(CLOSED);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /** Number of timestamps waiting to be received. */
    public int pending() {
        return (int) queue.stream().filter(OptionalLong::isPresent).count();
    }

    public String getName() {
        return name;
    }
}
