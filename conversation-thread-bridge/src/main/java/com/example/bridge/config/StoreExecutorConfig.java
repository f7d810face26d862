package com.example.bridge.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pool running mapping store calls so that each call can be abandoned after the store
 * timeout. A full queue rejects instead of running on the caller, which turns overload into
 * {@code StoreUnavailableException} rather than a stalled request thread.
 */
@Slf4j
@Configuration
public class StoreExecutorConfig {

    public static final String STORE_EXECUTOR = "mappingStoreExecutor";
    public static final String EVENT_EXECUTOR = "mappingEventExecutor";

    @Bean(name = STORE_EXECUTOR, destroyMethod = "shutdown")
    public ThreadPoolExecutor mappingStoreExecutor(BridgeProperties properties) {
        BridgeProperties.Executor config = properties.getExecutor();
        return buildExecutor("mapping-store-", config.getCoreThreads(), config.getMaxThreads(), config.getQueueCapacity());
    }

    /**
     * Single sender thread for Kafka publishing, so a broker stall holds up events and never the
     * request that raised them.
     */
    @Bean(name = EVENT_EXECUTOR, destroyMethod = "shutdown")
    public ThreadPoolExecutor mappingEventExecutor(BridgeProperties properties) {
        return buildExecutor("mapping-events-", 1, 1, properties.getEvents().getQueueCapacity());
    }

    ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory(prefix), new LoggingRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    static final class LoggingRejectionHandler implements RejectedExecutionHandler {

        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong();

        LoggingRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long count = rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}': active={}, poolSize={}, queueSize={}, totalRejections={}",
                    poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + poolName + "' saturated (rejected " + count + " tasks)");
        }

        long getRejectionCount() {
            return rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
