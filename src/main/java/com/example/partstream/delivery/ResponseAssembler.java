package com.example.partstream.delivery;

import com.example.partstream.part.PartContext;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a window and wraps the outcomes into a {@link ProgressiveResponse}.
 */
public class ResponseAssembler {

    private final PartEvaluator evaluator;
    private final Clock clock;

    public ResponseAssembler(PartEvaluator evaluator, Clock clock) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ProgressiveResponse assemble(ChunkWindow window, PartContext context) {
        List<PartOutcome> outcomes = evaluator.evaluateAll(window.parts(), context);
        List<Map<String, Object>> results = new ArrayList<>(outcomes.size());
        for (PartOutcome outcome : outcomes) {
            // singletonMap keeps null values
            results.add(Collections.singletonMap(outcome.name(), outcome.payload()));
        }
        ProgressiveResponse.Meta meta = new ProgressiveResponse.Meta(
                window.totalParts(),
                window.size(),
                window.hasMore(),
                Instant.now(clock).toString());
        return new ProgressiveResponse(results, window.nextCursor(), meta);
    }
}
