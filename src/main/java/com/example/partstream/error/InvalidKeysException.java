package com.example.partstream.error;

/**
 * The key-based request named no usable part keys.
 */
public class InvalidKeysException extends PartstreamException {

    public static final String CODE = "validation_error";

    public InvalidKeysException(String message) {
        super(CODE, message);
    }

    @Override
    public boolean isClientError() {
        return true;
    }
}
