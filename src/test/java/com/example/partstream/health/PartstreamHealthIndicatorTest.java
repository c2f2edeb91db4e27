package com.example.partstream.health;

import com.example.partstream.cursor.AesGcmCursorCodec;
import com.example.partstream.cursor.CursorCodec;
import com.example.partstream.part.PartCache;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PartstreamHealthIndicatorTest {

    private final CursorCodec codec = new AesGcmCursorCodec("health-secret", null, 1024, Clock.systemUTC());

    @Test
    void upWhenCodecAndCacheWork() {
        PartCache.InMemory cache = new PartCache.InMemory();

        Health health = new PartstreamHealthIndicator(codec, cache, 3).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("cursorCodec", "ok")
                .containsEntry("partCache", "InMemory")
                .containsEntry("chunkSize", 3);
        assertThat(cache.size()).isZero();
    }

    @Test
    void downWhenCodecFails() {
        CursorCodec broken = mock(CursorCodec.class);
        when(broken.encode(anyMap())).thenThrow(new IllegalStateException("no cipher"));

        Health health = new PartstreamHealthIndicator(broken, new PartCache.InMemory(), 2).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("cursorCodec", "IllegalStateException");
    }

    @Test
    void downWhenCacheLosesWrites() {
        PartCache forgetful = mock(PartCache.class);
        when(forgetful.get(any())).thenReturn(Optional.empty());

        Health health = new PartstreamHealthIndicator(codec, forgetful, 2).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsKey("partCache");
    }

    @Test
    void probeUsesNamespacedKey() {
        assertThat(PartstreamHealthIndicator.PROBE_KEY).isEqualTo("partstream:health-probe");
    }
}
