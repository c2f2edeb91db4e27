package com.example.partstream.delivery;

import com.example.partstream.error.PartEvaluationException;

/**
 * Result of evaluating one part: either a value (possibly {@code null}) or an isolated failure.
 */
public record PartOutcome(String name, Object value, PartEvaluationException error, long elapsedNanos) {

    public static PartOutcome success(String name, Object value, long elapsedNanos) {
        return new PartOutcome(name, value, null, elapsedNanos);
    }

    public static PartOutcome failure(PartEvaluationException error, long elapsedNanos) {
        return new PartOutcome(error.partName(), null, error, elapsedNanos);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** What goes into the part's result slot: the value, or the inline error object. */
    public Object payload() {
        return error == null ? value : error.toPayload();
    }
}
