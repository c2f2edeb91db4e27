package com.example.partstream.delivery;

import com.example.partstream.audit.AuditListener;
import com.example.partstream.cursor.AesGcmCursorCodec;
import com.example.partstream.error.CursorExpiredException;
import com.example.partstream.error.InvalidCursorException;
import com.example.partstream.error.TooManyKeysRequestedException;
import com.example.partstream.metrics.DeliveryMetrics;
import com.example.partstream.part.PartCache;
import com.example.partstream.part.PartContext;
import com.example.partstream.part.PartRegistry;
import com.example.partstream.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ProgressiveDeliveryTest {

    private MutableClock clock;
    private SimpleMeterRegistry meters;
    private AuditListener audit;
    private ProgressiveDelivery delivery;
    private final AtomicInteger analyticsCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        meters = new SimpleMeterRegistry();
        audit = mock(AuditListener.class);
        DeliveryMetrics metrics = new DeliveryMetrics(meters);
        AesGcmCursorCodec codec = new AesGcmCursorCodec("facade-secret", Duration.ofMinutes(10), 1024, clock);
        PartEvaluator evaluator = PartEvaluator.sequential();
        delivery = new ProgressiveDelivery(
                new Chunker(codec, 2, 50),
                new ResponseAssembler(evaluator, clock),
                new KeyedPartAccessor(evaluator, 3, clock),
                new PartCache.InMemory(clock),
                Duration.ofMinutes(5),
                metrics,
                audit);
    }

    private PartRegistry dashboard() {
        return delivery.newRegistry()
                .addStatic("meta", Map.of("title", "Dashboard"))
                .addFunction("orders", ctx -> List.of("o1", "o2"))
                .addFunction("whoami", ctx -> ctx.principal().orElse("nobody") + "/" + ctx.cursorContext().get("tenant"))
                .addCached("analytics", ctx -> Map.of("total", analyticsCalls.incrementAndGet()))
                .addFunction("broken", ctx -> {
                    throw new IllegalStateException("downstream unavailable");
                });
    }

    @Test
    void clientAssemblesWholeResponseByFollowingCursors() {
        PartContext ctx = PartContext.builder().principal("alice").carry("tenant", "acme").build();
        List<String> names = new ArrayList<>();
        List<ProgressiveResponse> pages = new ArrayList<>();
        String cursor = null;
        do {
            ProgressiveResponse page = delivery.deliver(dashboard(), cursor, ctx);
            pages.add(page);
            page.results().forEach(r -> names.addAll(r.keySet()));
            cursor = page.cursor();
        } while (cursor != null);

        assertThat(names).containsExactly("meta", "orders", "whoami", "analytics", "broken");
        assertThat(pages).hasSize(3);
        assertThat(pages.get(0).meta().hasMore()).isTrue();
        assertThat(pages.get(2).meta().currentChunkSize()).isEqualTo(1);
        assertThat(pages.get(2).meta().hasMore()).isFalse();
        assertThat(pages.get(1).results().get(0).get("whoami")).isEqualTo("alice/acme");
        assertThat(pages.get(2).results().get(0).get("broken"))
                .isEqualTo(Map.of("error", "Failed to load broken: downstream unavailable", "type", "loading_error"));
        verify(audit).onDelivery(ctx, AuditListener.Mode.CURSOR, 2, false);
        assertThat(meters.summary(DeliveryMetrics.WINDOW_SIZE).count()).isEqualTo(3);
    }

    @Test
    void perRequestChunkSizeOverridesDefault() {
        ProgressiveResponse page = delivery.deliver(dashboard(), null, PartContext.anonymous(), 4);

        assertThat(page.results()).hasSize(4);
        assertThat(page.meta().totalParts()).isEqualTo(5);
    }

    @Test
    void cachedPartIsComputedOnceAcrossRequests() {
        delivery.fetchByKeys(dashboard(), List.of("analytics"), PartContext.anonymous());
        KeyedResponse second = delivery.fetchByKeys(dashboard(), List.of("analytics"), PartContext.anonymous());

        assertThat(second.results().get("analytics")).isEqualTo(Map.of("total", 1));
        assertThat(analyticsCalls).hasValue(1);
    }

    @Test
    void expiredCursorIsRejectedAndAudited() {
        PartContext ctx = PartContext.anonymous();
        String cursor = delivery.deliver(dashboard(), null, ctx).cursor();
        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> delivery.deliver(dashboard(), cursor, ctx)).isInstanceOf(CursorExpiredException.class);
        verify(audit).onRejected(ctx, CursorExpiredException.CODE);
        assertThat(meters.counter(DeliveryMetrics.CURSOR_REJECTED, "code", "cursor_expired").count()).isEqualTo(1.0);
    }

    @Test
    void tamperedCursorIsRejected() {
        String cursor = delivery.deliver(dashboard(), null, PartContext.anonymous()).cursor();
        String tampered = (cursor.charAt(5) == 'x' ? "y" : "x");
        String forged = cursor.substring(0, 5) + tampered + cursor.substring(6);

        assertThatThrownBy(() -> delivery.deliver(dashboard(), forged, PartContext.anonymous()))
                .isInstanceOf(InvalidCursorException.class);
        assertThat(meters.counter(DeliveryMetrics.CURSOR_REJECTED, "code", "invalid_cursor").count()).isEqualTo(1.0);
    }

    @Test
    void tooManyKeysIsAuditedWithoutEvaluating() {
        List<String> keys = delivery.parseKeys("meta,orders,whoami,analytics");

        assertThatThrownBy(() -> delivery.fetchByKeys(dashboard(), keys, PartContext.anonymous()))
                .isInstanceOf(TooManyKeysRequestedException.class);
        assertThat(analyticsCalls).hasValue(0);
        verify(audit).onRejected(any(), eq(TooManyKeysRequestedException.CODE));
        verify(audit, never()).onDelivery(any(), any(), anyInt(), anyBoolean());
    }

    @Test
    void manifestDescribesPartsWithoutEvaluating() {
        Map<String, ManifestEntry> manifest = delivery.manifest(dashboard());

        assertThat(manifest.keySet()).containsExactly("meta", "orders", "whoami", "analytics", "broken");
        assertThat(manifest.get("meta").type()).isEqualTo("static");
        assertThat(manifest.get("meta").index()).isZero();
        assertThat(manifest.get("analytics").type()).isEqualTo("lazy");
        assertThat(manifest.get("analytics").kind()).isEqualTo("cached");
        assertThat(manifest.get("analytics").index()).isEqualTo(3);
        assertThat(analyticsCalls).hasValue(0);
    }
}
