package com.example.bridge.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson client backing the lifecycle sweep lock. Only created when the sweep is configured to
 * coordinate across instances.
 */
@Configuration
@ConditionalOnProperty(prefix = "bridge.lifecycle", name = "distributed-lock", havingValue = "true", matchIfMissing = true)
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redisAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setUsername(redisProperties.getUsername())
                .setPassword(StringUtils.hasText(redisProperties.getPassword()) ? redisProperties.getPassword() : null)
                .setConnectionMinimumIdleSize(1)
                .setConnectionPoolSize(4);
        return Redisson.create(config);
    }

    static String redisAddress(RedisProperties redisProperties) {
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (ssl ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
