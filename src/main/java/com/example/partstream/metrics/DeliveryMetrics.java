package com.example.partstream.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed counters and timers for progressive delivery.
 */
public class DeliveryMetrics {

    public static final String PART_EVALUATION = "partstream.part.evaluation";
    public static final String CACHE_LOOKUPS = "partstream.cache.lookups";
    public static final String CURSOR_REJECTED = "partstream.cursor.rejected";
    public static final String WINDOW_SIZE = "partstream.window.size";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ERROR = "error";
    public static final String OUTCOME_TIMEOUT = "timeout";

    private final MeterRegistry registry;

    public DeliveryMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics recorded into a private registry, for code running outside a Spring context. */
    public static DeliveryMetrics standalone() {
        return new DeliveryMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void partEvaluated(String part, String outcome, long elapsedNanos) {
        Timer.builder(PART_EVALUATION)
                .description("Time spent evaluating a single part")
                .tag("part", part)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void cacheLookup(boolean hit) {
        Counter.builder(CACHE_LOOKUPS)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void cursorRejected(String code) {
        Counter.builder(CURSOR_REJECTED)
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void windowServed(int parts) {
        DistributionSummary.builder(WINDOW_SIZE)
                .description("Number of parts evaluated per request")
                .register(registry)
                .record(parts);
    }
}
