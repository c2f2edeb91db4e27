package com.example.partstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code partstream.*} prefix. Validated at startup by {@link PartstreamGuard}.
 */
@ConfigurationProperties(prefix = "partstream")
public class PartstreamProperties {

    /** Server-wide secret the cursor key is derived from. Required. */
    private String secret;
    private int chunkSize = 2;
    private int maxChunkSize = 50;
    /** Default cursor lifetime; zero disables expiry. */
    private Duration cursorTtl = Duration.ofHours(1);
    private int maxKeysPerRequest = 10;
    /** Longest accepted cursor string, in characters. */
    private int maxCursorSize = 1024;

    private final Evaluation evaluation = new Evaluation();
    private final Cache cache = new Cache();
    private final Audit audit = new Audit();

    public String getSecret() { return secret; }
    public void setSecret(String secret) { this.secret = secret; }
    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
    public int getMaxChunkSize() { return maxChunkSize; }
    public void setMaxChunkSize(int maxChunkSize) { this.maxChunkSize = maxChunkSize; }
    public Duration getCursorTtl() { return cursorTtl; }
    public void setCursorTtl(Duration cursorTtl) { this.cursorTtl = cursorTtl; }
    public int getMaxKeysPerRequest() { return maxKeysPerRequest; }
    public void setMaxKeysPerRequest(int maxKeysPerRequest) { this.maxKeysPerRequest = maxKeysPerRequest; }
    public int getMaxCursorSize() { return maxCursorSize; }
    public void setMaxCursorSize(int maxCursorSize) { this.maxCursorSize = maxCursorSize; }
    public Evaluation getEvaluation() { return evaluation; }
    public Cache getCache() { return cache; }
    public Audit getAudit() { return audit; }

    public static class Evaluation {
        /** In-flight producer calls per request; 1 evaluates sequentially. */
        private int maxConcurrency = 1;
        /** Per-part timeout; unset means none. */
        private Duration partTimeout;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public Duration getPartTimeout() { return partTimeout; }
        public void setPartTimeout(Duration partTimeout) { this.partTimeout = partTimeout; }
    }

    public static class Cache {
        private Duration defaultTtl = Duration.ofMinutes(5);

        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }
    }

    public static class Audit {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
