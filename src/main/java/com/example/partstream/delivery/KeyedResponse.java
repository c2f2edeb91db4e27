package com.example.partstream.delivery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Envelope returned by key-based access. {@code results} is keyed by part name in the
 * order the keys were requested.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record KeyedResponse(
        @JsonProperty("results") Map<String, Object> results,
        @JsonProperty("requested_keys") List<String> requestedKeys,
        @JsonProperty("timestamp") String timestamp) {

    public KeyedResponse {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        requestedKeys = List.copyOf(requestedKeys);
    }
}
