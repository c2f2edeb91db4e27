package com.example.partstream.error;

/**
 * The cursor is malformed, oversized, failed authentication, or decrypted to an
 * unexpected structure.
 */
public class InvalidCursorException extends PartstreamException {

    public static final String CODE = "invalid_cursor";

    public InvalidCursorException(String detail) {
        super(CODE, detail);
    }

    public InvalidCursorException(String detail, Throwable cause) {
        super(CODE, detail, cause);
    }

    @Override
    public boolean isClientError() {
        return true;
    }
}
