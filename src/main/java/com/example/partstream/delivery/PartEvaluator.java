package com.example.partstream.delivery;

import com.example.partstream.error.PartEvaluationException;
import com.example.partstream.metrics.DeliveryMetrics;
import com.example.partstream.part.Part;
import com.example.partstream.part.PartContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates parts with per-part failure isolation, preserving the input order in its output.
 * <p>
 * With a concurrency cap of one and no timeout, parts run inline on the calling thread.
 * Otherwise they run on worker threads, at most {@code maxConcurrency} at a time; the caller's
 * MDC is copied into each worker. A part that exceeds the timeout gets a {@code timeout_error}
 * slot and its worker is interrupted. Its permit is returned as soon as its slot is filled,
 * so a producer that ignores interruption can briefly push in-flight calls above the cap.
 * <p>
 * {@link Error}s thrown by a producer are not isolated and propagate to the caller.
 */
@Slf4j
public class PartEvaluator implements AutoCloseable {

    private final int maxConcurrency;
    private final Duration partTimeout;
    private final DeliveryMetrics metrics;

    private final Semaphore permits;
    private final ExecutorService workers;
    private final ScheduledThreadPoolExecutor watchdog;

    public PartEvaluator(int maxConcurrency, Duration partTimeout, DeliveryMetrics metrics) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive but was " + maxConcurrency);
        }
        if (partTimeout != null && (partTimeout.isNegative() || partTimeout.isZero())) {
            partTimeout = null;
        }
        this.maxConcurrency = maxConcurrency;
        this.partTimeout = partTimeout;
        this.metrics = metrics == null ? DeliveryMetrics.standalone() : metrics;

        if (isInline()) {
            this.permits = null;
            this.workers = null;
            this.watchdog = null;
        } else {
            this.permits = new Semaphore(maxConcurrency);
            this.workers = Executors.newCachedThreadPool(daemonThreads("partstream-eval-"));
            if (partTimeout != null) {
                this.watchdog = new ScheduledThreadPoolExecutor(1, daemonThreads("partstream-timeout-"));
                this.watchdog.setRemoveOnCancelPolicy(true);
            } else {
                this.watchdog = null;
            }
        }
    }

    /** Sequential, inline evaluation without a timeout. */
    public static PartEvaluator sequential() {
        return new PartEvaluator(1, null, null);
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public Duration partTimeout() {
        return partTimeout;
    }

    /**
     * Evaluate every part. The returned list has one outcome per part, in the same order.
     */
    public List<PartOutcome> evaluateAll(List<? extends Part> parts, PartContext context) {
        Objects.requireNonNull(context, "context");
        List<PartOutcome> outcomes = new ArrayList<>(parts.size());
        if (isInline()) {
            for (Part part : parts) {
                PartOutcome outcome = attempt(part, context);
                record(outcome);
                outcomes.add(outcome);
            }
            return outcomes;
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<PartOutcome>> pending = new ArrayList<>(parts.size());
        boolean interrupted = false;
        for (Part part : parts) {
            if (!interrupted) {
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                }
            }
            if (interrupted) {
                pending.add(CompletableFuture.completedFuture(interruptedOutcome(part)));
                continue;
            }
            try {
                pending.add(submit(part, context, mdc));
            } catch (RejectedExecutionException e) {
                permits.release();
                throw new IllegalStateException("part evaluator is closed", e);
            }
        }

        for (int i = 0; i < pending.size(); i++) {
            CompletableFuture<PartOutcome> future = pending.get(i);
            if (interrupted) {
                PartOutcome fallback = interruptedOutcome(parts.get(i));
                if (future.complete(fallback)) {
                    outcomes.add(fallback);
                    continue;
                }
            }
            try {
                outcomes.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                i--;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("unexpected failure evaluating part " + parts.get(i).name(), cause);
            }
        }
        outcomes.forEach(this::record);
        return outcomes;
    }

    /** Evaluate a single part on the calling thread, without the timeout. */
    public PartOutcome evaluate(Part part, PartContext context) {
        PartOutcome outcome = attempt(part, context);
        record(outcome);
        return outcome;
    }

    private CompletableFuture<PartOutcome> submit(Part part, PartContext context, Map<String, String> mdc) {
        CompletableFuture<PartOutcome> slot = new CompletableFuture<>();
        slot.whenComplete((outcome, failure) -> permits.release());

        Future<?> running = workers.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                slot.complete(attempt(part, context));
            } catch (Throwable t) {
                slot.completeExceptionally(t);
            } finally {
                MDC.clear();
            }
        });

        if (partTimeout != null) {
            long millis = partTimeout.toMillis();
            ScheduledFuture<?> timer = watchdog.schedule(() -> {
                PartOutcome timedOut = PartOutcome.failure(
                        PartEvaluationException.timeout(part.name(), millis), TimeUnit.MILLISECONDS.toNanos(millis));
                if (slot.complete(timedOut)) {
                    log.warn("Part {} timed out after {}ms", part.name(), millis);
                    running.cancel(true);
                }
            }, millis, TimeUnit.MILLISECONDS);
            slot.whenComplete((outcome, failure) -> timer.cancel(false));
        }
        return slot;
    }

    private PartOutcome attempt(Part part, PartContext context) {
        long started = System.nanoTime();
        try {
            Object value = part.evaluate(context);
            return PartOutcome.success(part.name(), value, System.nanoTime() - started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Part {} was interrupted", part.name());
            return PartOutcome.failure(PartEvaluationException.loading(part.name(), e), System.nanoTime() - started);
        } catch (Exception e) {
            log.warn("Part {} failed: {}", part.name(), e.toString());
            log.debug("Part {} failure detail", part.name(), e);
            return PartOutcome.failure(PartEvaluationException.loading(part.name(), e), System.nanoTime() - started);
        }
    }

    private void record(PartOutcome outcome) {
        String result;
        if (outcome.isSuccess()) {
            result = DeliveryMetrics.OUTCOME_SUCCESS;
        } else if (outcome.error().kind() == PartEvaluationException.ErrorKind.TIMEOUT) {
            result = DeliveryMetrics.OUTCOME_TIMEOUT;
        } else {
            result = DeliveryMetrics.OUTCOME_ERROR;
        }
        metrics.partEvaluated(outcome.name(), result, outcome.elapsedNanos());
    }

    private static PartOutcome interruptedOutcome(Part part) {
        return PartOutcome.failure(
                PartEvaluationException.loading(part.name(), new InterruptedException("evaluation interrupted")), 0L);
    }

    private boolean isInline() {
        return maxConcurrency == 1 && partTimeout == null;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        if (workers != null) {
            workers.shutdownNow();
        }
        if (watchdog != null) {
            watchdog.shutdownNow();
        }
    }
}
