package com.example.partstream.delivery;

import com.example.partstream.error.InvalidKeysException;
import com.example.partstream.error.TooManyKeysRequestedException;
import com.example.partstream.part.Part;
import com.example.partstream.part.PartContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Random access to named parts, independent of any cursor.
 * <p>
 * Unknown names and names outside the allow-list get an inline marker instead of failing
 * the request; only exceeding the key limit rejects the whole call, before anything runs.
 */
@Slf4j
public class KeyedPartAccessor {

    public static final String NOT_FOUND = "not_found";
    public static final String NOT_ALLOWED = "not_allowed";

    private final PartEvaluator evaluator;
    private final int maxKeys;
    private final Clock clock;

    public KeyedPartAccessor(PartEvaluator evaluator, int maxKeys, Clock clock) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be positive but was " + maxKeys);
        }
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.maxKeys = maxKeys;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int maxKeys() {
        return maxKeys;
    }

    public KeyedResponse fetch(List<? extends Part> parts, Collection<String> keys, PartContext context) {
        return fetch(parts, keys, context, null);
    }

    /**
     * @param allowedKeys names the caller may request; {@code null} allows every part
     * @throws TooManyKeysRequestedException if more distinct keys than the limit are requested
     */
    public KeyedResponse fetch(List<? extends Part> parts,
                               Collection<String> keys,
                               PartContext context,
                               Set<String> allowedKeys) {
        List<String> requested = new ArrayList<>(new LinkedHashSet<>(keys));
        if (requested.size() > maxKeys) {
            throw new TooManyKeysRequestedException(requested.size(), maxKeys);
        }

        Map<String, Part> byName = new HashMap<>();
        for (Part part : parts) {
            byName.put(part.name(), part);
        }

        Map<String, Object> results = new LinkedHashMap<>();
        List<Part> toEvaluate = new ArrayList<>();
        for (String key : requested) {
            Part part = byName.get(key);
            if (part == null) {
                results.put(key, marker("Part '" + key + "' not found", NOT_FOUND));
            } else if (allowedKeys != null && !allowedKeys.contains(key)) {
                log.debug("Key {} is not in the allowed set", key);
                results.put(key, marker("Part '" + key + "' not allowed", NOT_ALLOWED));
            } else {
                results.put(key, null);
                toEvaluate.add(part);
            }
        }

        for (PartOutcome outcome : evaluator.evaluateAll(toEvaluate, context)) {
            results.put(outcome.name(), outcome.payload());
        }
        return new KeyedResponse(results, requested, Instant.now(clock).toString());
    }

    /**
     * Split a comma-separated key list, trimming blanks away.
     *
     * @throws InvalidKeysException if the parameter is missing or names no key
     */
    public static List<String> parseKeys(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isEmpty()) {
            throw new InvalidKeysException("Missing 'keys' parameter");
        }
        List<String> keys = new ArrayList<>();
        for (String raw : commaSeparated.split(",")) {
            String key = raw.trim();
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        if (keys.isEmpty()) {
            throw new InvalidKeysException("No valid keys provided");
        }
        return keys;
    }

    private static Map<String, Object> marker(String message, String type) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        out.put("type", type);
        return out;
    }
}
