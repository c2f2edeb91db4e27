package com.example.partstream.error;

import java.time.Duration;

/**
 * The cursor is authentic but older than its time-to-live. Kept distinct from
 * {@link InvalidCursorException} so that clients can restart from the first chunk.
 */
public class CursorExpiredException extends PartstreamException {

    public static final String CODE = "cursor_expired";

    private final Duration age;
    private final Duration ttl;

    public CursorExpiredException(Duration age, Duration ttl) {
        super(CODE, "cursor expired: age " + age.toMillis() + "ms exceeds ttl " + ttl.toMillis() + "ms");
        this.age = age;
        this.ttl = ttl;
    }

    public Duration age() {
        return age;
    }

    public Duration ttl() {
        return ttl;
    }

    @Override
    public boolean isClientError() {
        return true;
    }
}
