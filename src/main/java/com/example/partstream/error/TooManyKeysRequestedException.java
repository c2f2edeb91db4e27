package com.example.partstream.error;

public class TooManyKeysRequestedException extends PartstreamException {

    public static final String CODE = "too_many_keys";

    private final int requested;
    private final int limit;

    public TooManyKeysRequestedException(int requested, int limit) {
        super(CODE, "Too many keys requested: " + requested + ". Maximum: " + limit);
        this.requested = requested;
        this.limit = limit;
    }

    public int requested() {
        return requested;
    }

    public int limit() {
        return limit;
    }

    @Override
    public boolean isClientError() {
        return true;
    }
}
