package com.libragraph.chatvault.util;

/**
 * Thrown when a read runs past the end of the underlying bytes.
 */
public class TruncatedDataException extends RuntimeException {

    private final int position;
    private final int requested;

    public TruncatedDataException(int position, int requested, int available) {
        super("Unexpected end of data at " + position + ": needed " + requested
                + " bytes, " + available + " available");
        this.position = position;
        this.requested = requested;
    }

    public int position() {
        return position;
    }

    public int requested() {
        return requested;
    }
}
