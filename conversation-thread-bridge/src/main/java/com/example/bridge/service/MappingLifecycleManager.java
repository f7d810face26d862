package com.example.bridge.service;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.domain.SweepReport;
import com.example.bridge.domain.ThreadMapping;
import com.example.bridge.event.MappingEventPublisher;
import com.example.bridge.event.MappingEventType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes mappings that have not seen activity for longer than the inactivity threshold. Each
 * candidate is deleted with a re-check, so a conversation that resumes while the sweep runs keeps
 * its mapping.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MappingLifecycleManager {

    private final MappingStore mappingStore;
    private final MappingEventPublisher eventPublisher;
    private final BridgeProperties bridgeProperties;
    private final ObjectProvider<RedissonClient> redissonClient;
    private final Clock clock;

    @Scheduled(
            initialDelayString = "#{T(java.time.Duration).parse('${bridge.lifecycle.sweep-interval:PT1H}').toMillis()}",
            fixedDelayString = "#{T(java.time.Duration).parse('${bridge.lifecycle.sweep-interval:PT1H}').toMillis()}")
    public void scheduledSweep() {
        if (!bridgeProperties.getLifecycle().isEnabled()) {
            return;
        }
        try {
            SweepReport report = sweepWithLock();
            if (!report.isSkipped()) {
                log.info("Lifecycle sweep removed {} mappings idle since before {}",
                        report.getDeleted(), report.getDeleteBound());
            }
        } catch (Exception ex) {
            log.error("Lifecycle sweep failed", ex);
        }
    }

    /**
     * Runs one sweep with the configured threshold and grace window, coordinating with other
     * instances when the distributed lock is enabled.
     */
    public SweepReport sweepWithLock() {
        BridgeProperties.Lifecycle lifecycle = bridgeProperties.getLifecycle();
        RedissonClient client = lifecycle.isDistributedLock() ? redissonClient.getIfAvailable() : null;
        if (client == null) {
            return sweep(lifecycle.getInactivityThreshold(), lifecycle.getGraceWindow());
        }

        RLock lock = client.getLock(bridgeProperties.getRedis().sweepLockKey());
        boolean acquired;
        try {
            acquired = lock.tryLock(0, lifecycle.getLockLease().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return SweepReport.skipped(Instant.now(clock));
        }
        if (!acquired) {
            log.debug("Sweep lock held by another instance, skipping this cycle");
            return SweepReport.skipped(Instant.now(clock));
        }
        try {
            return sweep(lifecycle.getInactivityThreshold(), lifecycle.getGraceWindow());
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    /**
     * Deletes mappings whose last activity is older than {@code now - inactivityThreshold}. The bound
     * is fixed when the sweep starts and re-checked on every delete, so rows touched after the start
     * are kept. A positive grace window limits how long one sweep keeps taking new batches.
     */
    public SweepReport sweep(Duration inactivityThreshold, Duration graceWindow) {
        if (inactivityThreshold == null || inactivityThreshold.isNegative() || inactivityThreshold.isZero()) {
            throw new IllegalArgumentException("Inactivity threshold must be positive");
        }
        Duration grace = graceWindow == null || graceWindow.isNegative() ? Duration.ZERO : graceWindow;
        int batchSize = Math.max(1, bridgeProperties.getLifecycle().getBatchSize());

        Instant startedAt = Instant.now(clock);
        Instant deleteBound = startedAt.minus(inactivityThreshold);
        Instant stopAfter = startedAt.plus(grace);

        long deleted = 0;
        while (true) {
            List<ThreadMapping> batch = mappingStore.findInactive(deleteBound, batchSize);
            if (batch.isEmpty()) {
                break;
            }
            int deletedInBatch = 0;
            for (ThreadMapping mapping : batch) {
                if (mappingStore.deleteIfInactive(mapping.getThreadId(), deleteBound)) {
                    deletedInBatch++;
                    eventPublisher.publish(MappingEventType.MAPPING_EXPIRED, mapping);
                } else {
                    log.debug("Thread {} saw activity during the sweep, keeping it", mapping.getThreadId());
                }
            }
            deleted += deletedInBatch;
            if (deletedInBatch == 0 || batch.size() < batchSize) {
                break;
            }
            if (!grace.isZero() && Instant.now(clock).isAfter(stopAfter)) {
                log.info("Sweep ran past its {} grace window, leaving remaining mappings for the next cycle", grace);
                break;
            }
        }

        return SweepReport.builder()
                .deleted(deleted)
                .startedAt(startedAt)
                .completedAt(Instant.now(clock))
                .deleteBound(deleteBound)
                .build();
    }
}
