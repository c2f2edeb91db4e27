package com.example.partstream.cursor;

import com.example.partstream.error.CursorExpiredException;
import com.example.partstream.error.CursorTooLargeException;
import com.example.partstream.error.InvalidCursorException;

import java.time.Duration;
import java.util.Map;

/**
 * Turns a small continuation state into an opaque, tamper-evident token and back.
 * <p>
 * Implementations are stateless on the server: any instance configured with the same
 * secret can decode a token issued by any other instance.
 */
public interface CursorCodec {

    /**
     * Encode {@code payload} with the codec's default time-to-live.
     */
    String encode(Map<String, ?> payload);

    /**
     * Encode {@code payload}. When {@code ttl} is non-null an issue timestamp is sealed
     * into the token together with the ttl.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized to JSON or the ttl is negative
     * @throws CursorTooLargeException  if the token would be longer than the codec accepts on decode
     */
    String encode(Map<String, ?> payload, Duration ttl);

    /**
     * Decode and authenticate a token.
     * <p>
     * The payload comes back as its JSON reading: numbers take Jackson's natural types
     * ({@code Integer}, {@code Long}, {@code Double}), so a {@code 42L} that fits an int
     * is returned as {@code Integer 42}, and lists and nested maps come back as
     * {@code List} and {@code Map}.
     *
     * @return the encoded payload, equal to it as JSON
     * @throws InvalidCursorException if the token is malformed, oversized, forged or structurally unexpected
     * @throws CursorExpiredException if the token is authentic but older than its ttl
     */
    Map<String, Object> decode(String token);

    /** Non-throwing probe equivalent to {@link #decode(String)}. */
    default boolean isValid(String token) {
        try {
            decode(token);
            return true;
        } catch (InvalidCursorException | CursorExpiredException e) {
            return false;
        }
    }
}
