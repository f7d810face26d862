package com.example.bridge.config;

import com.example.bridge.domain.MappingStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    /**
     * Strategy used to turn a conversation context into a thread id.
     */
    @NotNull
    private MappingStrategy strategy = MappingStrategy.HASH;

    /**
     * Whether the channel serves several tenants. When true an inbound activity without a tenant
     * is rejected.
     */
    private boolean multiTenant = true;

    /**
     * Tenant applied to activities without one when {@link #multiTenant} is false.
     */
    private String defaultTenantId;

    @Valid
    @NestedConfigurationProperty
    private final Hash hash = new Hash();

    @Valid
    @NestedConfigurationProperty
    private final Database database = new Database();

    @Valid
    @NestedConfigurationProperty
    private final Lifecycle lifecycle = new Lifecycle();

    @Valid
    @NestedConfigurationProperty
    private final Events events = new Events();

    @Valid
    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @Valid
    @NestedConfigurationProperty
    private final Executor executor = new Executor();

    public MappingStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(MappingStrategy strategy) {
        this.strategy = strategy;
    }

    public boolean isMultiTenant() {
        return multiTenant;
    }

    public void setMultiTenant(boolean multiTenant) {
        this.multiTenant = multiTenant;
    }

    public String getDefaultTenantId() {
        return defaultTenantId;
    }

    public void setDefaultTenantId(String defaultTenantId) {
        this.defaultTenantId = defaultTenantId;
    }

    public Hash getHash() {
        return hash;
    }

    public Database getDatabase() {
        return database;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public Events getEvents() {
        return events;
    }

    public Redis getRedis() {
        return redis;
    }

    public Executor getExecutor() {
        return executor;
    }

    @Validated
    public static class Hash {

        /**
         * Prefix prepended to hash-derived thread ids.
         */
        @NotBlank
        private String prefix = "thread";

        /**
         * {@link java.security.MessageDigest} algorithm applied to the scope key.
         */
        @NotBlank
        private String algorithm = "SHA-256";

        /**
         * Number of hex characters of the digest kept in the thread id.
         */
        @Min(8)
        @Max(64)
        private int length = 16;

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(String algorithm) {
            this.algorithm = algorithm;
        }

        public int getLength() {
            return length;
        }

        public void setLength(int length) {
            this.length = length;
        }
    }

    @Validated
    public static class Database {

        /**
         * Persistence backend holding thread mappings.
         */
        @NotNull
        private Backend backend = Backend.JPA;

        /**
         * Prefix prepended to randomly generated thread ids.
         */
        @NotBlank
        private String threadIdPrefix = "thread";

        /**
         * Upper bound for a single store call on the resolution path.
         */
        @NotNull
        private Duration storeTimeout = Duration.ofSeconds(2);

        /**
         * Read/create cycles attempted before giving up on a contended scope.
         */
        @Min(1)
        private int maxCreateAttempts = 3;

        /**
         * Resolve with the hash strategy when the store is unavailable.
         */
        private boolean fallbackToHash = false;

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }

        public String getThreadIdPrefix() {
            return threadIdPrefix;
        }

        public void setThreadIdPrefix(String threadIdPrefix) {
            this.threadIdPrefix = threadIdPrefix;
        }

        public Duration getStoreTimeout() {
            return storeTimeout;
        }

        public void setStoreTimeout(Duration storeTimeout) {
            this.storeTimeout = storeTimeout;
        }

        public int getMaxCreateAttempts() {
            return maxCreateAttempts;
        }

        public void setMaxCreateAttempts(int maxCreateAttempts) {
            this.maxCreateAttempts = maxCreateAttempts;
        }

        public boolean isFallbackToHash() {
            return fallbackToHash;
        }

        public void setFallbackToHash(boolean fallbackToHash) {
            this.fallbackToHash = fallbackToHash;
        }
    }

    public enum Backend {
        JPA,
        MONGO
    }

    @Validated
    public static class Lifecycle {

        /**
         * Toggle for the scheduled sweep. The on-demand sweep endpoint ignores it.
         */
        private boolean enabled = true;

        /**
         * Mappings idle for longer than this are removed.
         */
        @NotNull
        private Duration inactivityThreshold = Duration.ofDays(90);

        /**
         * Delay between two scheduled sweeps.
         */
        @NotNull
        private Duration sweepInterval = Duration.ofHours(1);

        /**
         * Mappings touched within this window before the sweep started are never removed,
         * whatever the threshold.
         */
        @NotNull
        private Duration graceWindow = Duration.ofMinutes(5);

        /**
         * Number of candidates selected per round trip.
         */
        @Min(1)
        private int batchSize = 500;

        /**
         * Guard the sweep with a Redis lock so only one instance runs it at a time.
         */
        private boolean distributedLock = true;

        /**
         * Lease after which a lock held by a crashed instance is released.
         */
        @NotNull
        private Duration lockLease = Duration.ofMinutes(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInactivityThreshold() {
            return inactivityThreshold;
        }

        public void setInactivityThreshold(Duration inactivityThreshold) {
            this.inactivityThreshold = inactivityThreshold;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getGraceWindow() {
            return graceWindow;
        }

        public void setGraceWindow(Duration graceWindow) {
            this.graceWindow = graceWindow;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isDistributedLock() {
            return distributedLock;
        }

        public void setDistributedLock(boolean distributedLock) {
            this.distributedLock = distributedLock;
        }

        public Duration getLockLease() {
            return lockLease;
        }

        public void setLockLease(Duration lockLease) {
            this.lockLease = lockLease;
        }
    }

    @Validated
    public static class Events {

        /**
         * Publish mapping lifecycle events to Kafka.
         */
        private boolean enabled = true;

        /**
         * Kafka topic receiving mapping lifecycle events.
         */
        @NotBlank
        private String topic = "bridge.mapping-lifecycle";

        /**
         * Events waiting for the Kafka sender thread. Further events are dropped with a warning.
         */
        @Min(10)
        private int queueCapacity = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the bridge.
         */
        @NotBlank
        private String keyPrefix = "bridge";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public String sweepLockKey() {
            return "%s:lifecycle:sweep-lock".formatted(keyPrefix);
        }
    }

    @Validated
    public static class Executor {

        private int coreThreads = 4;

        private int maxThreads = 16;

        private int queueCapacity = 500;

        public int getCoreThreads() {
            return coreThreads;
        }

        public void setCoreThreads(int coreThreads) {
            this.coreThreads = coreThreads;
        }

        public int getMaxThreads() {
            return maxThreads;
        }

        public void setMaxThreads(int maxThreads) {
            this.maxThreads = maxThreads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
