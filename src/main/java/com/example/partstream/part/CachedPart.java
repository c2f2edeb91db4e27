package com.example.partstream.part;

import com.example.partstream.metrics.DeliveryMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Function-backed part that consults the shared {@link PartCache} before calling its producer
 * and writes fresh values back with a time-to-live. {@code null} values and failures are
 * never cached.
 * <p>
 * With {@code perPrincipal} the key is scoped to the caller's principal so that one user's
 * data is never served to another; anonymous callers share the {@code anonymous} scope.
 */
@Slf4j
public final class CachedPart extends AbstractPart {

    static final String ANONYMOUS_SCOPE = "anonymous";

    private final PartProducer producer;
    private final PartCache cache;
    private final String baseKey;
    private final Duration ttl;
    private final boolean perPrincipal;
    private final DeliveryMetrics metrics;

    public CachedPart(String name,
                      PartProducer producer,
                      PartCache cache,
                      Duration ttl,
                      boolean perPrincipal,
                      boolean lazy,
                      DeliveryMetrics metrics) {
        this(name, producer, cache, null, ttl, perPrincipal, lazy, List.of(), metrics);
    }

    public CachedPart(String name,
                      PartProducer producer,
                      PartCache cache,
                      String cacheKey,
                      Duration ttl,
                      boolean perPrincipal,
                      boolean lazy,
                      List<String> dependsOn,
                      DeliveryMetrics metrics) {
        super(name, lazy, dependsOn);
        this.producer = Objects.requireNonNull(producer, "producer");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.baseKey = (cacheKey == null || cacheKey.isBlank()) ? name : cacheKey;
        this.ttl = ttl;
        this.perPrincipal = perPrincipal;
        this.metrics = metrics == null ? DeliveryMetrics.standalone() : metrics;
    }

    @Override
    public PartKind kind() {
        return PartKind.CACHED;
    }

    public Duration ttl() {
        return ttl;
    }

    /** The cache key this part uses for the given caller. */
    public String cacheKey(PartContext context) {
        String scope = perPrincipal ? context.principal().orElse(ANONYMOUS_SCOPE) : null;
        return PartCache.keyFor(baseKey, scope);
    }

    @Override
    protected Object compute(PartContext context) throws Exception {
        String key = cacheKey(context);
        Optional<Object> hit = cache.get(key);
        if (hit.isPresent()) {
            metrics.cacheLookup(true);
            log.debug("Cache hit for part {} ({})", name(), key);
            return hit.get();
        }
        metrics.cacheLookup(false);
        Object fresh = producer.produce(context);
        if (fresh != null) {
            cache.put(key, fresh, ttl);
            log.debug("Cached part {} ({}) for {}", name(), key, ttl);
        }
        return fresh;
    }
}
