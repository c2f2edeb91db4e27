package com.example.partstream.config;

import com.example.partstream.audit.AuditListener;
import com.example.partstream.audit.LoggingAuditListener;
import com.example.partstream.cursor.AesGcmCursorCodec;
import com.example.partstream.cursor.CursorCodec;
import com.example.partstream.delivery.Chunker;
import com.example.partstream.delivery.KeyedPartAccessor;
import com.example.partstream.delivery.PartEvaluator;
import com.example.partstream.delivery.ProgressiveDelivery;
import com.example.partstream.delivery.ResponseAssembler;
import com.example.partstream.health.PartstreamHealthIndicator;
import com.example.partstream.metrics.DeliveryMetrics;
import com.example.partstream.part.PartCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/**
 * Wires the delivery core from {@link PartstreamProperties}. The guard is injected first so
 * that a bad configuration is reported as a whole before any component rejects it.
 */
@Configuration
@EnableConfigurationProperties(PartstreamProperties.class)
@Import(PartstreamGuard.class)
public class PartstreamConfig {

    private final PartstreamProperties props;

    /**
     * @param verifiedBeforeWiring unused; requesting it makes the guard validate the properties
     *                             before any bean below is created
     */
    public PartstreamConfig(PartstreamProperties props, PartstreamGuard verifiedBeforeWiring) {
        this.props = props;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    Clock partstreamClock() {
        return Clock.systemUTC();
    }

    @Bean
    CursorCodec cursorCodec(Clock clock) {
        return new AesGcmCursorCodec(props.getSecret(), props.getCursorTtl(), props.getMaxCursorSize(), clock);
    }

    /** Process-local fallback; applications may provide a shared cache instead. */
    @Bean
    @ConditionalOnMissingBean(PartCache.class)
    PartCache partCache(Clock clock) {
        return new PartCache.InMemory(clock);
    }

    @Bean
    DeliveryMetrics deliveryMetrics(ObjectProvider<MeterRegistry> registry) {
        return new DeliveryMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean(AuditListener.class)
    AuditListener auditListener() {
        return props.getAudit().isEnabled() ? new LoggingAuditListener() : AuditListener.NOOP;
    }

    @Bean(destroyMethod = "close")
    PartEvaluator partEvaluator(DeliveryMetrics metrics) {
        PartstreamProperties.Evaluation e = props.getEvaluation();
        return new PartEvaluator(e.getMaxConcurrency(), e.getPartTimeout(), metrics);
    }

    @Bean
    Chunker chunker(CursorCodec codec) {
        return new Chunker(codec, props.getChunkSize(), props.getMaxChunkSize());
    }

    @Bean
    ResponseAssembler responseAssembler(PartEvaluator evaluator, Clock clock) {
        return new ResponseAssembler(evaluator, clock);
    }

    @Bean
    KeyedPartAccessor keyedPartAccessor(PartEvaluator evaluator, Clock clock) {
        return new KeyedPartAccessor(evaluator, props.getMaxKeysPerRequest(), clock);
    }

    @Bean
    ProgressiveDelivery progressiveDelivery(Chunker chunker,
                                            ResponseAssembler assembler,
                                            KeyedPartAccessor accessor,
                                            PartCache cache,
                                            DeliveryMetrics metrics,
                                            AuditListener audit) {
        return new ProgressiveDelivery(chunker, assembler, accessor, cache,
                props.getCache().getDefaultTtl(), metrics, audit);
    }

    @Bean
    PartstreamHealthIndicator partstreamHealthIndicator(CursorCodec codec, PartCache cache) {
        return new PartstreamHealthIndicator(codec, cache, props.getChunkSize());
    }
}
