package com.example.partstream.delivery;

import com.example.partstream.audit.AuditListener;
import com.example.partstream.error.CursorExpiredException;
import com.example.partstream.error.InvalidCursorException;
import com.example.partstream.error.PartstreamException;
import com.example.partstream.error.TooManyKeysRequestedException;
import com.example.partstream.metrics.DeliveryMetrics;
import com.example.partstream.part.Part;
import com.example.partstream.part.PartCache;
import com.example.partstream.part.PartContext;
import com.example.partstream.part.PartRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for application controllers.
 *
 * <pre>
 * PartRegistry parts = delivery.newRegistry()
 *         .addStatic("meta", Map.of("title", "Dashboard"))
 *         .addFunction("orders", ctx -&gt; orders.recentFor(ctx.principal().orElseThrow()));
 * return delivery.deliver(parts, cursor, PartContext.builder().principal(user).build());
 * </pre>
 *
 * Cursor and key-limit rejections propagate as {@link PartstreamException}s for the
 * HTTP layer to map; per-part failures never do.
 */
@Slf4j
public class ProgressiveDelivery {

    private static final int CURSOR_SAMPLE_CHARS = 20;

    private final Chunker chunker;
    private final ResponseAssembler assembler;
    private final KeyedPartAccessor accessor;
    private final PartCache cache;
    private final Duration defaultCacheTtl;
    private final DeliveryMetrics metrics;
    private final AuditListener audit;

    public ProgressiveDelivery(Chunker chunker,
                               ResponseAssembler assembler,
                               KeyedPartAccessor accessor,
                               PartCache cache,
                               Duration defaultCacheTtl,
                               DeliveryMetrics metrics,
                               AuditListener audit) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.cache = cache;
        this.defaultCacheTtl = defaultCacheTtl;
        this.metrics = metrics == null ? DeliveryMetrics.standalone() : metrics;
        this.audit = audit == null ? AuditListener.NOOP : audit;
    }

    /** A registry wired to the shared part cache and metrics. */
    public PartRegistry newRegistry() {
        return new PartRegistry(cache, defaultCacheTtl, metrics);
    }

    public ProgressiveResponse deliver(PartRegistry registry, String cursor, PartContext context) {
        return deliver(registry, cursor, context, 0);
    }

    /**
     * Serve the next window of {@code registry}.
     *
     * @param cursor    the cursor from the previous response, or {@code null} for the first request
     * @param chunkSize per-request window size; zero or negative means the configured default
     */
    public ProgressiveResponse deliver(PartRegistry registry, String cursor, PartContext context, int chunkSize) {
        Objects.requireNonNull(registry, "registry");
        PartContext ctx = context == null ? PartContext.anonymous() : context;

        ChunkWindow window;
        try {
            window = chunker.window(registry.parts(), cursor, chunkSize, ctx.carry());
        } catch (InvalidCursorException | CursorExpiredException e) {
            log.warn("Rejected cursor {}... (length {}): {}", sample(cursor), cursor.length(), e.getMessage());
            metrics.cursorRejected(e.code());
            audit.onRejected(ctx, e.code());
            throw e;
        }

        ProgressiveResponse response = assembler.assemble(window, ctx.withCursorContext(window.cursorContext()));
        metrics.windowServed(window.size());
        audit.onDelivery(ctx, AuditListener.Mode.CURSOR, window.size(), cursor != null && !cursor.isEmpty());
        log.debug("Delivered parts [{}, {}) of {} (more={})",
                window.start(), window.end(), window.totalParts(), window.hasMore());
        return response;
    }

    public KeyedResponse fetchByKeys(PartRegistry registry, Collection<String> keys, PartContext context) {
        return fetchByKeys(registry, keys, context, null);
    }

    /**
     * Evaluate only the named parts.
     *
     * @param allowedKeys optional allow-list; {@code null} allows every registered part
     */
    public KeyedResponse fetchByKeys(PartRegistry registry,
                                     Collection<String> keys,
                                     PartContext context,
                                     Set<String> allowedKeys) {
        Objects.requireNonNull(registry, "registry");
        PartContext ctx = context == null ? PartContext.anonymous() : context;
        KeyedResponse response;
        try {
            response = accessor.fetch(registry.parts(), keys, ctx, allowedKeys);
        } catch (TooManyKeysRequestedException e) {
            log.warn("Rejected key request: {}", e.getMessage());
            audit.onRejected(ctx, e.code());
            throw e;
        }
        metrics.windowServed(response.results().size());
        audit.onDelivery(ctx, AuditListener.Mode.KEYS, response.results().size(), false);
        return response;
    }

    /** See {@link KeyedPartAccessor#parseKeys(String)}. */
    public List<String> parseKeys(String commaSeparated) {
        return KeyedPartAccessor.parseKeys(commaSeparated);
    }

    /** Describe the registry's parts in order, without evaluating any of them. */
    public Map<String, ManifestEntry> manifest(PartRegistry registry) {
        Map<String, ManifestEntry> entries = new LinkedHashMap<>();
        int index = 0;
        for (Part part : registry) {
            entries.put(part.name(), ManifestEntry.of(part, index++));
        }
        return Collections.unmodifiableMap(entries);
    }

    public Chunker chunker() {
        return chunker;
    }

    static String sample(String cursor) {
        if (cursor == null) {
            return "";
        }
        return cursor.length() <= CURSOR_SAMPLE_CHARS ? cursor : cursor.substring(0, CURSOR_SAMPLE_CHARS);
    }
}
