package com.example.partstream.config;

import com.example.partstream.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup when the {@code partstream.*} settings are unusable.
 * All violations are reported together.
 */
@Slf4j
public class PartstreamGuard {

    private final PartstreamProperties p;

    public PartstreamGuard(PartstreamProperties p) {
        this.p = p;
    }

    @PostConstruct
    public void verify() {
        List<String> problems = problems(p);
        if (!problems.isEmpty()) {
            log.error("[partstream] invalid configuration: {}", problems);
            throw new ConfigurationException(problems);
        }
        log.info("[partstream] chunk-size={} max-chunk-size={} cursor-ttl={} max-keys={} concurrency={}",
                p.getChunkSize(), p.getMaxChunkSize(), p.getCursorTtl(), p.getMaxKeysPerRequest(),
                p.getEvaluation().getMaxConcurrency());
    }

    static List<String> problems(PartstreamProperties p) {
        List<String> out = new ArrayList<>();
        if (!StringUtils.hasText(p.getSecret())) {
            out.add("partstream.secret is required");
        }
        if (p.getChunkSize() <= 0) {
            out.add("partstream.chunk-size must be positive (was " + p.getChunkSize() + ")");
        } else if (p.getMaxChunkSize() < p.getChunkSize()) {
            out.add("partstream.max-chunk-size (" + p.getMaxChunkSize()
                    + ") must not be below partstream.chunk-size (" + p.getChunkSize() + ")");
        }
        if (p.getMaxKeysPerRequest() <= 0) {
            out.add("partstream.max-keys-per-request must be positive (was " + p.getMaxKeysPerRequest() + ")");
        }
        if (p.getMaxCursorSize() <= 0) {
            out.add("partstream.max-cursor-size must be positive (was " + p.getMaxCursorSize() + ")");
        }
        if (isNegative(p.getCursorTtl())) {
            out.add("partstream.cursor-ttl must not be negative");
        }
        if (p.getEvaluation().getMaxConcurrency() <= 0) {
            out.add("partstream.evaluation.max-concurrency must be positive (was "
                    + p.getEvaluation().getMaxConcurrency() + ")");
        }
        if (isNegative(p.getEvaluation().getPartTimeout())) {
            out.add("partstream.evaluation.part-timeout must not be negative");
        }
        if (isNegative(p.getCache().getDefaultTtl())) {
            out.add("partstream.cache.default-ttl must not be negative");
        }
        return out;
    }

    private static boolean isNegative(Duration d) {
        return d != null && d.isNegative();
    }
}
