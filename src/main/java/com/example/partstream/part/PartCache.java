package com.example.partstream.part;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Key-value cache used by cached parts.
 * Writes are last-writer-wins with a time-to-live; values are disposable and recomputable,
 * so no transactional guarantee is expected from an implementation.
 */
public interface PartCache {

    String KEY_PREFIX = "partstream:";

    Optional<Object> get(String key);

    /**
     * Store a non-null value. A {@code null}, zero or negative ttl stores the value without expiry.
     */
    void put(String key, Object value, Duration ttl);

    void evict(String key);

    void clear();

    /**
     * Build a cache key for a part, optionally scoped (e.g. per principal).
     */
    static String keyFor(String partName, String scope) {
        Objects.requireNonNull(partName, "partName");
        if (scope == null || scope.isBlank()) {
            return KEY_PREFIX + partName;
        }
        return KEY_PREFIX + partName + ":" + scope;
    }

    /**
     * Process-local implementation backed by a ConcurrentHashMap with TTL support.
     * Used when the application does not provide a distributed cache.
     */
    final class InMemory implements PartCache {
        private static final class Entry {
            final Object value;
            final long expireAtMillis; // -1 means no expiry
            Entry(Object value, long expireAtMillis) { this.value = value; this.expireAtMillis = expireAtMillis; }
        }

        static final int SWEEP_EVERY_WRITES = 256;

        private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
        private final AtomicLong writes = new AtomicLong();
        private final Clock clock;

        public InMemory() {
            this(Clock.systemUTC());
        }

        public InMemory(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        @Override
        public Optional<Object> get(String key) {
            Entry e = map.get(key);
            if (e == null) {
                return Optional.empty();
            }
            if (e.expireAtMillis >= 0 && e.expireAtMillis < clock.millis()) {
                map.remove(key, e);
                return Optional.empty();
            }
            return Optional.of(e.value);
        }

        @Override
        public void put(String key, Object value, Duration ttl) {
            Objects.requireNonNull(value, "value");
            long until = (ttl == null || ttl.isZero() || ttl.isNegative()) ? -1 : clock.millis() + ttl.toMillis();
            map.put(key, new Entry(value, until));
            if (writes.incrementAndGet() % SWEEP_EVERY_WRITES == 0) {
                purgeExpired();
            }
        }

        /**
         * Drop every expired entry. Runs on its own every {@value #SWEEP_EVERY_WRITES} writes,
         * so keys that are never read again do not pile up.
         *
         * @return number of entries removed
         */
        public int purgeExpired() {
            long now = clock.millis();
            int removed = 0;
            for (Map.Entry<String, Entry> e : map.entrySet()) {
                Entry entry = e.getValue();
                if (entry.expireAtMillis >= 0 && entry.expireAtMillis < now && map.remove(e.getKey(), entry)) {
                    removed++;
                }
            }
            return removed;
        }

        @Override
        public void evict(String key) {
            map.remove(key);
        }

        @Override
        public void clear() {
            map.clear();
        }

        public int size() {
            return map.size();
        }
    }
}
