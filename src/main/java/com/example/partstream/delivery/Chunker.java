package com.example.partstream.delivery;

import com.example.partstream.cursor.CursorCodec;
import com.example.partstream.error.ConfigurationException;
import com.example.partstream.error.InvalidCursorException;
import com.example.partstream.part.Part;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Selects the window of parts to evaluate for a request and issues the cursor for the rest.
 * <p>
 * Cursor payloads have the form {@code {...carry, "position": n}}. The {@code position} key is
 * reserved; a carried value under that name is overwritten.
 */
@Slf4j
public class Chunker {

    public static final String POSITION = "position";

    private final CursorCodec codec;
    private final int defaultChunkSize;
    private final int maxChunkSize;

    public Chunker(CursorCodec codec, int defaultChunkSize, int maxChunkSize) {
        this.codec = Objects.requireNonNull(codec, "codec");
        if (defaultChunkSize <= 0) {
            throw new ConfigurationException("chunk-size must be positive but was " + defaultChunkSize);
        }
        if (maxChunkSize < defaultChunkSize) {
            throw new ConfigurationException("max-chunk-size (" + maxChunkSize
                    + ") must not be below chunk-size (" + defaultChunkSize + ")");
        }
        this.defaultChunkSize = defaultChunkSize;
        this.maxChunkSize = maxChunkSize;
    }

    public ChunkWindow window(List<Part> parts, String cursor) {
        return window(parts, cursor, 0, Map.of());
    }

    /**
     * @param requestedChunkSize per-request window size; zero or negative falls back to the
     *                           configured default, values above the maximum are clamped
     * @param carry              fresh caller context to embed in the next cursor; it overrides
     *                           entries with the same name carried by the incoming cursor
     * @throws InvalidCursorException if the cursor is forged, malformed or carries a bad position
     * @throws com.example.partstream.error.CursorExpiredException if the cursor is past its ttl
     */
    public ChunkWindow window(List<Part> parts, String cursor, int requestedChunkSize, Map<String, Object> carry) {
        Objects.requireNonNull(parts, "parts");
        int total = parts.size();
        int chunkSize = effectiveChunkSize(requestedChunkSize);

        Map<String, Object> cursorContext = new LinkedHashMap<>();
        long start = 0;
        if (cursor != null && !cursor.isEmpty()) {
            Map<String, Object> payload = codec.decode(cursor);
            start = position(payload.get(POSITION));
            cursorContext.putAll(payload);
            cursorContext.remove(POSITION);
        }

        if (start >= total) {
            log.debug("Cursor position {} is past the end of {} parts; returning an empty window", start, total);
            return new ChunkWindow(List.of(), total, total, total, null, Collections.unmodifiableMap(cursorContext));
        }

        int from = (int) start;
        int to = (int) Math.min(start + chunkSize, total);
        String next = null;
        if (to < total) {
            Map<String, Object> state = new LinkedHashMap<>(cursorContext);
            if (carry != null) {
                state.putAll(carry);
            }
            state.remove(POSITION);
            state.put(POSITION, to);
            next = codec.encode(state);
        }
        return new ChunkWindow(parts.subList(from, to), from, to, total, next,
                Collections.unmodifiableMap(cursorContext));
    }

    public int effectiveChunkSize(int requested) {
        if (requested <= 0) {
            return defaultChunkSize;
        }
        return Math.min(requested, maxChunkSize);
    }

    public int defaultChunkSize() {
        return defaultChunkSize;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    private static long position(Object raw) {
        if (raw == null) {
            return 0;
        }
        long value;
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            value = ((Number) raw).longValue();
        } else if (raw instanceof BigInteger) {
            // beyond any list size
            value = ((BigInteger) raw).signum() < 0 ? -1 : Long.MAX_VALUE;
        } else {
            throw new InvalidCursorException("cursor position is not an integer");
        }
        if (value < 0) {
            throw new InvalidCursorException("cursor position is negative");
        }
        return value;
    }
}
