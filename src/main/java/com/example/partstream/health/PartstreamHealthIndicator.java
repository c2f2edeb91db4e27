package com.example.partstream.health;

import com.example.partstream.cursor.CursorCodec;
import com.example.partstream.part.PartCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Reports whether cursors can be sealed and opened with the configured secret and
 * whether the part cache accepts writes.
 */
public class PartstreamHealthIndicator implements HealthIndicator {

    static final String PROBE_KEY = PartCache.keyFor("health-probe", null);

    private final CursorCodec codec;
    private final PartCache cache;
    private final int chunkSize;

    public PartstreamHealthIndicator(CursorCodec codec, PartCache cache, int chunkSize) {
        this.codec = codec;
        this.cache = cache;
        this.chunkSize = chunkSize;
    }

    @Override
    public Health health() {
        Health.Builder builder = Health.up().withDetail("chunkSize", chunkSize);
        try {
            Map<String, Object> decoded = codec.decode(codec.encode(Map.of("probe", 1)));
            if (!Integer.valueOf(1).equals(decoded.get("probe"))) {
                return Health.down().withDetail("cursorCodec", "round trip mismatch").build();
            }
            builder.withDetail("cursorCodec", "ok");
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("cursorCodec", e.getClass().getSimpleName()).build();
        }

        if (cache == null) {
            return builder.withDetail("partCache", "none").build();
        }
        try {
            String token = Long.toString(System.nanoTime());
            cache.put(PROBE_KEY, token, Duration.ofSeconds(10));
            Optional<Object> back = cache.get(PROBE_KEY);
            cache.evict(PROBE_KEY);
            if (back.isEmpty() || !token.equals(back.get())) {
                return Health.down().withDetail("partCache", "probe entry not readable").build();
            }
            builder.withDetail("partCache", cache.getClass().getSimpleName());
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("partCache", e.getClass().getSimpleName()).build();
        }
        return builder.build();
    }
}
