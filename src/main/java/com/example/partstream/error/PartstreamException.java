package com.example.partstream.error;

/**
 * Base type for every classified failure raised by the progressive delivery core.
 * <p>
 * Each subclass carries a stable machine-readable {@link #code()} that the HTTP layer
 * returns to clients. The exception message is meant for logs and may contain detail
 * that must not be echoed back to the caller.
 */
public abstract class PartstreamException extends RuntimeException {

    private final String code;

    protected PartstreamException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected PartstreamException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Whether the failure was caused by the client request rather than by the server. */
    public abstract boolean isClientError();
}
