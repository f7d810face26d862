package com.example.bridge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "bridge.security")
public class BridgeSecurityProperties {

    /**
     * Toggle for the per-client limiter in front of the mapping API.
     */
    private boolean rateLimitingEnabled = true;

    private final RateLimit rateLimit = new RateLimit();

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    @Validated
    public static class RateLimit {

        /**
         * Burst size per client and endpoint.
         */
        private long capacity = 600;

        /**
         * Tokens added back every {@link #refillPeriod}.
         */
        private long refillTokens = 600;

        private Duration refillPeriod = Duration.ofSeconds(60);

        /**
         * Upper bound on client and endpoint buckets held in memory. The least recently used bucket
         * is dropped first.
         */
        private int maxTrackedKeys = 10_000;

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }

        public int getMaxTrackedKeys() {
            return maxTrackedKeys;
        }

        public void setMaxTrackedKeys(int maxTrackedKeys) {
            this.maxTrackedKeys = maxTrackedKeys;
        }
    }
}
