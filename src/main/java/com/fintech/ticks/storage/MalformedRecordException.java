package com.fintech.ticks.storage;

import java.nio.file.Path;

/**
 * A stored row failed to parse during a read-back. Aborts the whole scan.
 */
public class MalformedRecordException extends TickLogException {

    private final Path file;
    private final long lineNumber;
    private final String row;

    public MalformedRecordException(Path file, long lineNumber, String row, Throwable cause) {
        super("Malformed row at " + file + ":" + lineNumber + ": '" + row + "'", cause);
        this.file = file;
        this.lineNumber = lineNumber;
        this.row = row;
    }

    public Path getFile() {
        return file;
    }

    /** 1-based line number, header included. */
    public long getLineNumber() {
        return lineNumber;
    }

    public String getRow() {
        return row;
    }
}
