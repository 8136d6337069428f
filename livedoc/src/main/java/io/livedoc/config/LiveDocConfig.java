package io.livedoc.config;

import io.livedoc.util.Env;

import java.time.Duration;

/**
 * Runtime configuration shared by the HTTP and socket services.
 *
 * Loaded from environment variables (system properties as fallback) by {@link #fromEnv()}.
 * Validated at startup by {@code StartupConfigValidator}.
 */
public record LiveDocConfig(
    String httpHost,
    int httpPort,
    String socketHost,
    int socketPort,

    // Store
    StoreType store,
    String dbUri,
    String dbName,
    int storePoolSize,
    Duration storeTimeout,
    int storeRetryAttempts,
    Duration storeRetryInitialDelay,
    Duration storeRetryMaxDelay,

    // Change feed
    ChangeFeedType changeFeed,
    Duration changeRetention,
    Duration tailPollInterval,
    int tailBatchSize,
    Duration tailGapTimeout,

    // Socket sessions
    int subscriberBufferSize,
    int maxInFlightSends,
    int dispatchThreads,
    Duration heartbeatTimeout,
    Duration reaperInterval,
    Duration flushTimeout,
    String socketToken      // empty = handshake without token
) {

    public enum StoreType { MONGO, MEMORY }

    public enum ChangeFeedType { POLL, CHANGESTREAM }

    /**
     * Defaults matching the reference deployment (HTTP 3000, socket 5000, MongoDB on 27017).
     */
    public static LiveDocConfig defaults() {
        return builder().build();
    }

    public static LiveDocConfig fromEnv() {
        LiveDocConfig d = defaults();
        return builder()
            .httpHost(Env.get("HTTP_HOST", d.httpHost()))
            .httpPort(Env.getInt("HTTP_PORT", d.httpPort()))
            .socketHost(Env.get("SOCKET_HOST", d.socketHost()))
            .socketPort(Env.getInt("SOCKET_PORT", d.socketPort()))
            .store(parseEnum(StoreType.class, "STORE", d.store()))
            .dbUri(Env.get("DB_URI", d.dbUri()))
            .dbName(Env.get("DB_NAME", d.dbName()))
            .storePoolSize(Env.getInt("STORE_POOL_SIZE", d.storePoolSize()))
            .storeTimeout(millis("STORE_TIMEOUT_MS", d.storeTimeout()))
            .storeRetryAttempts(Env.getInt("STORE_RETRY_ATTEMPTS", d.storeRetryAttempts()))
            .storeRetryInitialDelay(millis("STORE_RETRY_INITIAL_MS", d.storeRetryInitialDelay()))
            .storeRetryMaxDelay(millis("STORE_RETRY_MAX_MS", d.storeRetryMaxDelay()))
            .changeFeed(parseEnum(ChangeFeedType.class, "CHANGE_FEED", d.changeFeed()))
            .changeRetention(Duration.ofSeconds(Env.getLong("CHANGE_RETENTION_SECONDS", d.changeRetention().getSeconds())))
            .tailPollInterval(millis("TAIL_POLL_INTERVAL_MS", d.tailPollInterval()))
            .tailBatchSize(Env.getInt("TAIL_BATCH_SIZE", d.tailBatchSize()))
            .tailGapTimeout(millis("TAIL_GAP_TIMEOUT_MS", d.tailGapTimeout()))
            .subscriberBufferSize(Env.getInt("SUBSCRIBER_BUFFER_SIZE", d.subscriberBufferSize()))
            .maxInFlightSends(Env.getInt("MAX_IN_FLIGHT_SENDS", d.maxInFlightSends()))
            .dispatchThreads(Env.getInt("DISPATCH_THREADS", d.dispatchThreads()))
            .heartbeatTimeout(millis("HEARTBEAT_TIMEOUT_MS", d.heartbeatTimeout()))
            .reaperInterval(millis("REAPER_INTERVAL_MS", d.reaperInterval()))
            .flushTimeout(millis("FLUSH_TIMEOUT_MS", d.flushTimeout()))
            .socketToken(Env.get("SOCKET_TOKEN", d.socketToken()).trim())
            .build();
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return validPort(httpPort) && validPort(socketPort)
            && storePoolSize > 0
            && storeRetryAttempts > 0
            && positive(storeTimeout)
            && positive(storeRetryInitialDelay)
            && storeRetryInitialDelay.compareTo(storeRetryMaxDelay) <= 0
            && positive(tailPollInterval)
            && tailBatchSize > 0
            && !tailGapTimeout.isNegative()
            && subscriberBufferSize > 0
            && maxInFlightSends > 0
            && dispatchThreads > 0
            && positive(heartbeatTimeout)
            && positive(reaperInterval)
            && !flushTimeout.isNegative()
            && (store == StoreType.MEMORY || (dbUri != null && !dbUri.isBlank()));
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean validPort(int port) {
        return port >= 0 && port <= 65535;
    }

    private static boolean positive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }

    private static Duration millis(String key, Duration defaultValue) {
        return Duration.ofMillis(Env.getLong(key, defaultValue.toMillis()));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, E defaultValue) {
        String raw = Env.get(key, defaultValue.name());
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for " + key + ": " + raw, e);
        }
    }

    public static final class Builder {
        private String httpHost = "0.0.0.0";
        private int httpPort = 3000;
        private String socketHost = "0.0.0.0";
        private int socketPort = 5000;
        private StoreType store = StoreType.MONGO;
        private String dbUri = "mongodb://mongo:27017";
        private String dbName = "livedoc";
        private int storePoolSize = 20;
        private Duration storeTimeout = Duration.ofSeconds(2);
        private int storeRetryAttempts = 3;
        private Duration storeRetryInitialDelay = Duration.ofMillis(50);
        private Duration storeRetryMaxDelay = Duration.ofSeconds(1);
        private ChangeFeedType changeFeed = ChangeFeedType.POLL;
        private Duration changeRetention = Duration.ofDays(1);
        private Duration tailPollInterval = Duration.ofMillis(200);
        private int tailBatchSize = 500;
        private Duration tailGapTimeout = Duration.ofSeconds(1);
        private int subscriberBufferSize = 256;
        private int maxInFlightSends = 64;
        private int dispatchThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private Duration heartbeatTimeout = Duration.ofSeconds(60);
        private Duration reaperInterval = Duration.ofSeconds(5);
        private Duration flushTimeout = Duration.ofSeconds(3);
        private String socketToken = "";

        private Builder() {
        }

        private Builder(LiveDocConfig c) {
            this.httpHost = c.httpHost;
            this.httpPort = c.httpPort;
            this.socketHost = c.socketHost;
            this.socketPort = c.socketPort;
            this.store = c.store;
            this.dbUri = c.dbUri;
            this.dbName = c.dbName;
            this.storePoolSize = c.storePoolSize;
            this.storeTimeout = c.storeTimeout;
            this.storeRetryAttempts = c.storeRetryAttempts;
            this.storeRetryInitialDelay = c.storeRetryInitialDelay;
            this.storeRetryMaxDelay = c.storeRetryMaxDelay;
            this.changeFeed = c.changeFeed;
            this.changeRetention = c.changeRetention;
            this.tailPollInterval = c.tailPollInterval;
            this.tailBatchSize = c.tailBatchSize;
            this.tailGapTimeout = c.tailGapTimeout;
            this.subscriberBufferSize = c.subscriberBufferSize;
            this.maxInFlightSends = c.maxInFlightSends;
            this.dispatchThreads = c.dispatchThreads;
            this.heartbeatTimeout = c.heartbeatTimeout;
            this.reaperInterval = c.reaperInterval;
            this.flushTimeout = c.flushTimeout;
            this.socketToken = c.socketToken;
        }

        public Builder httpHost(String v) { this.httpHost = v; return this; }
        public Builder httpPort(int v) { this.httpPort = v; return this; }
        public Builder socketHost(String v) { this.socketHost = v; return this; }
        public Builder socketPort(int v) { this.socketPort = v; return this; }
        public Builder store(StoreType v) { this.store = v; return this; }
        public Builder dbUri(String v) { this.dbUri = v; return this; }
        public Builder dbName(String v) { this.dbName = v; return this; }
        public Builder storePoolSize(int v) { this.storePoolSize = v; return this; }
        public Builder storeTimeout(Duration v) { this.storeTimeout = v; return this; }
        public Builder storeRetryAttempts(int v) { this.storeRetryAttempts = v; return this; }
        public Builder storeRetryInitialDelay(Duration v) { this.storeRetryInitialDelay = v; return this; }
        public Builder storeRetryMaxDelay(Duration v) { this.storeRetryMaxDelay = v; return this; }
        public Builder changeFeed(ChangeFeedType v) { this.changeFeed = v; return this; }
        public Builder changeRetention(Duration v) { this.changeRetention = v; return this; }
        public Builder tailPollInterval(Duration v) { this.tailPollInterval = v; return this; }
        public Builder tailBatchSize(int v) { this.tailBatchSize = v; return this; }
        public Builder tailGapTimeout(Duration v) { this.tailGapTimeout = v; return this; }
        public Builder subscriberBufferSize(int v) { this.subscriberBufferSize = v; return this; }
        public Builder maxInFlightSends(int v) { this.maxInFlightSends = v; return this; }
        public Builder dispatchThreads(int v) { this.dispatchThreads = v; return this; }
        public Builder heartbeatTimeout(Duration v) { this.heartbeatTimeout = v; return this; }
        public Builder reaperInterval(Duration v) { this.reaperInterval = v; return this; }
        public Builder flushTimeout(Duration v) { this.flushTimeout = v; return this; }
        public Builder socketToken(String v) { this.socketToken = v == null ? "" : v; return this; }

        public LiveDocConfig build() {
            return new LiveDocConfig(httpHost, httpPort, socketHost, socketPort,
                store, dbUri, dbName, storePoolSize, storeTimeout,
                storeRetryAttempts, storeRetryInitialDelay, storeRetryMaxDelay,
                changeFeed, changeRetention, tailPollInterval, tailBatchSize, tailGapTimeout,
                subscriberBufferSize, maxInFlightSends, dispatchThreads,
                heartbeatTimeout, reaperInterval, flushTimeout, socketToken);
        }
    }
}
