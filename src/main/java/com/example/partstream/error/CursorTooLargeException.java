package com.example.partstream.error;

/**
 * A cursor about to be issued would exceed the configured maximum size, so the client
 * could never send it back. Raised on the server side at issue time.
 */
public class CursorTooLargeException extends PartstreamException {

    public static final String CODE = "cursor_too_large";

    private final int length;
    private final int limit;

    public CursorTooLargeException(int length, int limit) {
        super(CODE, "issued cursor length " + length + " exceeds " + limit
                + "; shrink the carry-through context or raise partstream.max-cursor-size");
        this.length = length;
        this.limit = limit;
    }

    public int length() {
        return length;
    }

    public int limit() {
        return limit;
    }

    @Override
    public boolean isClientError() {
        return false;
    }
}
