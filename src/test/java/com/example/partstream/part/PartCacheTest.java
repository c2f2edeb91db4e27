package com.example.partstream.part;

import com.example.partstream.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PartCacheTest {

    private MutableClock clock;
    private PartCache.InMemory cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        cache = new PartCache.InMemory(clock);
    }

    @Test
    void expiredKeysThatAreNeverReadAgainAreSweptOnWrite() {
        for (int i = 1; i < PartCache.InMemory.SWEEP_EVERY_WRITES; i++) {
            cache.put(PartCache.keyFor("analytics", "user-" + i), "v" + i, Duration.ofSeconds(30));
        }
        assertThat(cache.size()).isEqualTo(PartCache.InMemory.SWEEP_EVERY_WRITES - 1);

        clock.advance(Duration.ofMinutes(1));
        cache.put(PartCache.keyFor("analytics", "late-user"), "fresh", Duration.ofSeconds(30));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("partstream:analytics:late-user")).contains("fresh");
    }

    @Test
    void purgeKeepsLiveAndUnboundedEntries() {
        cache.put("short", "a", Duration.ofSeconds(10));
        cache.put("long", "b", Duration.ofHours(1));
        cache.put("forever", "c", null);

        clock.advance(Duration.ofMinutes(1));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("long")).contains("b");
        assertThat(cache.get("forever")).contains("c");
    }

    @Test
    void keysAreNamespacedAndOptionallyScoped() {
        assertThat(PartCache.keyFor("orders", null)).isEqualTo("partstream:orders");
        assertThat(PartCache.keyFor("orders", " ")).isEqualTo("partstream:orders");
        assertThat(PartCache.keyFor("orders", "alice")).isEqualTo("partstream:orders:alice");
    }
}
