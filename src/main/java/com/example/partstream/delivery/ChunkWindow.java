package com.example.partstream.delivery;

import com.example.partstream.part.Part;

import java.util.List;
import java.util.Map;

/**
 * The half-open slice {@code [start, end)} of a part list selected for one request,
 * plus the cursor for the remaining parts ({@code null} when nothing remains).
 *
 * @param cursorContext caller context decoded from the incoming cursor, without the position
 */
public record ChunkWindow(List<Part> parts,
                          int start,
                          int end,
                          int totalParts,
                          String nextCursor,
                          Map<String, Object> cursorContext) {

    public ChunkWindow {
        parts = List.copyOf(parts);
        cursorContext = cursorContext == null ? Map.of() : cursorContext;
    }

    public boolean hasMore() {
        return nextCursor != null;
    }

    public int size() {
        return parts.size();
    }
}
