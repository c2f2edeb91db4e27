package com.example.partstream.delivery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Envelope returned by cursor-based delivery.
 *
 * <pre>
 * {"results": [{"meta": {...}}, {"orders": [...]}],
 *  "cursor": "AZx..." | null,
 *  "meta": {"total_parts": 5, "current_chunk_size": 2, "has_more": true, "timestamp": "..."}}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ProgressiveResponse(
        @JsonProperty("results") List<Map<String, Object>> results,
        @JsonProperty("cursor") String cursor,
        @JsonProperty("meta") Meta meta) {

    public ProgressiveResponse {
        results = List.copyOf(results);
    }

    public boolean hasMore() {
        return cursor != null;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Meta(
            @JsonProperty("total_parts") int totalParts,
            @JsonProperty("current_chunk_size") int currentChunkSize,
            @JsonProperty("has_more") boolean hasMore,
            @JsonProperty("timestamp") String timestamp) {
    }
}
