package com.example.partstream.part;

import com.example.partstream.metrics.DeliveryMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, declarative list of the parts that make up one logical response.
 * <p>
 * Applications build a fresh registry per request. Cursors only carry positions, so the
 * caller must rebuild the same parts in the same order on every request that presents a
 * cursor; a registry whose contents depend on wall-clock time or an unordered query breaks
 * chunk coverage.
 *
 * <pre>
 * PartRegistry registry = delivery.newRegistry()
 *         .addStatic("meta", Map.of("version", "1.0"))
 *         .addFunction("orders", ctx -&gt; orderService.recent(ctx.principal().orElseThrow()))
 *         .addCached("analytics", ctx -&gt; analytics.compute(), Duration.ofMinutes(5));
 * </pre>
 */
public class PartRegistry implements Iterable<Part> {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    private final List<Part> parts = new ArrayList<>();
    private final Map<String, Part> byName = new HashMap<>();

    private final PartCache cache;
    private final Duration defaultCacheTtl;
    private final DeliveryMetrics metrics;

    /** Registry without a cache; {@code addCached} is unavailable. */
    public PartRegistry() {
        this(null, DEFAULT_CACHE_TTL, DeliveryMetrics.standalone());
    }

    public PartRegistry(PartCache cache, Duration defaultCacheTtl, DeliveryMetrics metrics) {
        this.cache = cache;
        this.defaultCacheTtl = defaultCacheTtl == null ? DEFAULT_CACHE_TTL : defaultCacheTtl;
        this.metrics = metrics == null ? DeliveryMetrics.standalone() : metrics;
    }

    /**
     * @throws IllegalArgumentException if a part with the same name is already registered
     */
    public PartRegistry add(Part part) {
        if (byName.putIfAbsent(part.name(), part) != null) {
            throw new IllegalArgumentException("duplicate part name: " + part.name());
        }
        parts.add(part);
        return this;
    }

    public PartRegistry addStatic(String name, Object value) {
        return add(new StaticPart(name, value));
    }

    /** Adds a lazy function-backed part. */
    public PartRegistry addFunction(String name, PartProducer producer) {
        return addFunction(name, producer, true);
    }

    public PartRegistry addFunction(String name, PartProducer producer, boolean lazy) {
        return add(new FunctionPart(name, producer, lazy));
    }

    public PartRegistry addFunction(String name, PartProducer producer, boolean lazy, List<String> dependsOn) {
        return add(new FunctionPart(name, producer, lazy, dependsOn));
    }

    public PartRegistry addCached(String name, PartProducer producer) {
        return addCached(name, producer, defaultCacheTtl);
    }

    public PartRegistry addCached(String name, PartProducer producer, Duration ttl) {
        return addCached(name, producer, ttl, false);
    }

    /**
     * @param perPrincipal scope the cache entry to the caller's principal
     */
    public PartRegistry addCached(String name, PartProducer producer, Duration ttl, boolean perPrincipal) {
        if (cache == null) {
            throw new IllegalStateException("no PartCache configured for cached part " + name);
        }
        return add(new CachedPart(name, producer, cache, ttl, perPrincipal, true, metrics));
    }

    public List<Part> parts() {
        return Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public Optional<Part> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return parts.size();
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    @Override
    public Iterator<Part> iterator() {
        return Collections.unmodifiableList(parts).iterator();
    }
}
