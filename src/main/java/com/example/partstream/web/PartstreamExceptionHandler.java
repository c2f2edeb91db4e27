package com.example.partstream.web;

import com.example.partstream.error.CursorExpiredException;
import com.example.partstream.error.InvalidCursorException;
import com.example.partstream.error.InvalidKeysException;
import com.example.partstream.error.PartstreamException;
import com.example.partstream.error.TooManyKeysRequestedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps request-level delivery failures raised from application controllers to HTTP 400
 * bodies of the form {@code {"error", "code", "timestamp"}}. Cursor failure detail stays
 * in the log.
 */
@Slf4j
@RestControllerAdvice
public class PartstreamExceptionHandler {

    private final Clock clock;

    public PartstreamExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(InvalidCursorException.class)
    public ResponseEntity<Map<String, Object>> invalidCursor(InvalidCursorException e) {
        log.debug("Invalid cursor: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid cursor", e.code());
    }

    @ExceptionHandler(CursorExpiredException.class)
    public ResponseEntity<Map<String, Object>> expiredCursor(CursorExpiredException e) {
        return body(HttpStatus.BAD_REQUEST, "Cursor expired", e.code());
    }

    @ExceptionHandler({TooManyKeysRequestedException.class, InvalidKeysException.class})
    public ResponseEntity<Map<String, Object>> badKeys(PartstreamException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), e.code());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> missingParameter(MissingServletRequestParameterException e) {
        return body(HttpStatus.BAD_REQUEST, "Missing '" + e.getParameterName() + "' parameter", InvalidKeysException.CODE);
    }

    @ExceptionHandler(PartstreamException.class)
    public ResponseEntity<Map<String, Object>> other(PartstreamException e) {
        if (e.isClientError()) {
            return body(HttpStatus.BAD_REQUEST, e.getMessage(), e.code());
        }
        log.error("Progressive delivery failed: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", e.code());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String code) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        out.put("code", code);
        out.put("timestamp", Instant.now(clock).toString());
        return ResponseEntity.status(status).body(out);
    }
}
