package com.fintech.ticks.feed;

/**
 * Raised when a feed frame is not valid JSON or matches none of the known frame shapes.
 */
public class FeedProtocolException extends RuntimeException {

    private final String frame;

    public FeedProtocolException(String message, String frame) {
        super(message);
        this.frame = frame;
    }

    public FeedProtocolException(String message, String frame, Throwable cause) {
        super(message, cause);
        this.frame = frame;
    }

    /** The raw frame that could not be decoded. */
    public String getFrame() {
        return frame;
    }
}
