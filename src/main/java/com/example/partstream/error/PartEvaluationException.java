package com.example.partstream.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure of a single part's producer. Never escapes a request: the evaluator turns it
 * into the inline error object returned in that part's slot.
 */
public class PartEvaluationException extends PartstreamException {

    public static final String CODE = "part_processing_error";

    public enum ErrorKind {
        LOADING("loading_error"),
        TIMEOUT("timeout_error");

        private final String type;

        ErrorKind(String type) {
            this.type = type;
        }

        public String type() {
            return type;
        }
    }

    private final String partName;
    private final ErrorKind kind;

    public PartEvaluationException(String partName, ErrorKind kind, String message, Throwable cause) {
        super(CODE, message, cause);
        this.partName = partName;
        this.kind = kind;
    }

    public static PartEvaluationException loading(String partName, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new PartEvaluationException(partName, ErrorKind.LOADING,
                "Failed to load " + partName + ": " + reason, cause);
    }

    public static PartEvaluationException timeout(String partName, long timeoutMillis) {
        return new PartEvaluationException(partName, ErrorKind.TIMEOUT,
                "Failed to load " + partName + ": timed out after " + timeoutMillis + "ms", null);
    }

    public String partName() {
        return partName;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** The inline payload placed in the part's result slot. */
    public Map<String, Object> toPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", getMessage());
        out.put("type", kind.type());
        return out;
    }

    @Override
    public boolean isClientError() {
        return false;
    }
}
