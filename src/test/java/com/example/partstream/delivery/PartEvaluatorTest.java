package com.example.partstream.delivery;

import com.example.partstream.error.PartEvaluationException;
import com.example.partstream.metrics.DeliveryMetrics;
import com.example.partstream.part.FunctionPart;
import com.example.partstream.part.Part;
import com.example.partstream.part.PartContext;
import com.example.partstream.part.StaticPart;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartEvaluatorTest {

    private final List<PartEvaluator> opened = new ArrayList<>();

    private PartEvaluator evaluator(int concurrency, Duration timeout, DeliveryMetrics metrics) {
        PartEvaluator e = new PartEvaluator(concurrency, timeout, metrics);
        opened.add(e);
        return e;
    }

    @AfterEach
    void tearDown() {
        opened.forEach(PartEvaluator::close);
        MDC.clear();
    }

    private static Part sleeping(String name, long millis, Object value) {
        return new FunctionPart(name, c -> {
            Thread.sleep(millis);
            return value;
        }, true);
    }

    @Test
    void isolatesFailuresAndKeepsOrder() {
        List<Part> parts = List.of(
                new StaticPart("a", 1),
                new FunctionPart("b", c -> {
                    throw new IllegalStateException("db offline");
                }, true),
                new StaticPart("c", 3));

        List<PartOutcome> outcomes = PartEvaluator.sequential().evaluateAll(parts, PartContext.anonymous());

        assertThat(outcomes).extracting(PartOutcome::name).containsExactly("a", "b", "c");
        assertThat(outcomes.get(0).payload()).isEqualTo(1);
        assertThat(outcomes.get(2).payload()).isEqualTo(3);
        assertThat(outcomes.get(1).isSuccess()).isFalse();
        assertThat(outcomes.get(1).error().kind()).isEqualTo(PartEvaluationException.ErrorKind.LOADING);
        assertThat(outcomes.get(1).payload()).isEqualTo(java.util.Map.of(
                "error", "Failed to load b: db offline",
                "type", "loading_error"));
    }

    @Test
    void errorsAreNotIsolated() {
        List<Part> parts = List.of(new FunctionPart("fatal", c -> {
            throw new AssertionError("boom");
        }, true));

        assertThatThrownBy(() -> PartEvaluator.sequential().evaluateAll(parts, PartContext.anonymous()))
                .isInstanceOf(AssertionError.class);
    }

    @Test
    void concurrentEvaluationPreservesInputOrder() {
        List<Part> parts = List.of(
                sleeping("slow", 300, "s"),
                sleeping("medium", 150, "m"),
                sleeping("fast", 10, "f"));

        List<PartOutcome> outcomes = evaluator(3, null, null).evaluateAll(parts, PartContext.anonymous());

        assertThat(outcomes).extracting(PartOutcome::payload).containsExactly("s", "m", "f");
    }

    @Test
    void respectsConcurrencyCap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Part> parts = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            int n = i;
            parts.add(new FunctionPart("p" + i, c -> {
                int now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(40);
                inFlight.decrementAndGet();
                return n;
            }, true));
        }

        List<PartOutcome> outcomes = evaluator(3, null, null).evaluateAll(parts, PartContext.anonymous());

        assertThat(outcomes).extracting(PartOutcome::payload).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(peak.get()).isBetween(1, 3);
    }

    @Test
    void timeoutFillsOnlyTheSlowSlot() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        List<Part> parts = List.of(
                new StaticPart("quick", "ok"),
                sleeping("stuck", 10_000, "never"),
                new StaticPart("after", "ok"));

        long started = System.nanoTime();
        List<PartOutcome> outcomes = evaluator(2, Duration.ofMillis(200), new DeliveryMetrics(meters))
                .evaluateAll(parts, PartContext.anonymous());
        long tookMillis = (System.nanoTime() - started) / 1_000_000;

        assertThat(outcomes).extracting(PartOutcome::name).containsExactly("quick", "stuck", "after");
        assertThat(outcomes.get(0).payload()).isEqualTo("ok");
        assertThat(outcomes.get(2).payload()).isEqualTo("ok");
        assertThat(outcomes.get(1).error().kind()).isEqualTo(PartEvaluationException.ErrorKind.TIMEOUT);
        assertThat(outcomes.get(1).error().toPayload()).containsEntry("type", "timeout_error");
        assertThat(tookMillis).isLessThan(5_000);
        assertThat(meters.timer(DeliveryMetrics.PART_EVALUATION, "part", "stuck", "outcome", "timeout").count())
                .isEqualTo(1);
    }

    @Test
    void timeoutAlsoAppliesWithSequentialCap() {
        List<Part> parts = List.of(sleeping("stuck", 10_000, "never"), new StaticPart("next", 2));

        List<PartOutcome> outcomes = evaluator(1, Duration.ofMillis(100), null)
                .evaluateAll(parts, PartContext.anonymous());

        assertThat(outcomes.get(0).error().kind()).isEqualTo(PartEvaluationException.ErrorKind.TIMEOUT);
        assertThat(outcomes.get(1).payload()).isEqualTo(2);
    }

    @Test
    void workersSeeCallerMdc() {
        MDC.put("trace", "req-42");
        Part part = new FunctionPart("traced", c -> MDC.get("trace"), true);

        List<PartOutcome> outcomes = evaluator(2, null, null).evaluateAll(List.of(part), PartContext.anonymous());

        assertThat(outcomes.get(0).payload()).isEqualTo("req-42");
    }

    @Test
    void recordsOutcomeTimers() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        PartEvaluator evaluator = new PartEvaluator(1, null, new DeliveryMetrics(meters));

        evaluator.evaluateAll(List.of(
                new StaticPart("a", 1),
                new FunctionPart("b", c -> {
                    throw new IllegalArgumentException("bad");
                }, true)), PartContext.anonymous());

        assertThat(meters.timer(DeliveryMetrics.PART_EVALUATION, "part", "a", "outcome", "success").count()).isEqualTo(1);
        assertThat(meters.timer(DeliveryMetrics.PART_EVALUATION, "part", "b", "outcome", "error").count()).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        assertThatThrownBy(() -> new PartEvaluator(0, null, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
