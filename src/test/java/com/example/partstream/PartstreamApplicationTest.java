package com.example.partstream;

import com.example.partstream.delivery.ProgressiveDelivery;
import com.example.partstream.delivery.ProgressiveResponse;
import com.example.partstream.health.PartstreamHealthIndicator;
import com.example.partstream.part.PartContext;
import com.example.partstream.part.PartRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PartstreamApplicationTest {

    @Autowired
    ProgressiveDelivery delivery;

    @Autowired
    PartstreamHealthIndicator health;

    @Test
    void contextServesProgressiveResponses() {
        PartRegistry registry = delivery.newRegistry()
                .addStatic("meta", Map.of("v", 1))
                .addFunction("orders", ctx -> 2)
                .addCached("analytics", ctx -> 3);

        ProgressiveResponse first = delivery.deliver(registry, null, PartContext.anonymous());
        ProgressiveResponse second = delivery.deliver(registry, first.cursor(), PartContext.anonymous());

        assertThat(first.results()).hasSize(2);
        assertThat(second.results()).hasSize(1);
        assertThat(second.cursor()).isNull();
    }

    @Test
    void healthIsUp() {
        Health h = health.health();

        assertThat(h.getStatus()).isEqualTo(Status.UP);
        assertThat(h.getDetails()).containsEntry("cursorCodec", "ok")
                .containsEntry("partCache", "InMemory")
                .containsEntry("chunkSize", 2);
    }
}
