package com.example.bridge.service.strategy;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadMapping;
import com.example.bridge.domain.ThreadResolution;
import com.example.bridge.event.MappingEventPublisher;
import com.example.bridge.event.MappingEventType;
import com.example.bridge.service.MappingStore;
import com.example.bridge.service.ScopeKeyFactory;
import com.example.bridge.service.StoreCallExecutor;
import com.example.bridge.service.exception.StoreConflictException;
import com.example.bridge.service.exception.StoreUnavailableException;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Looks the scope key up in the mapping store and creates a random thread id on first contact.
 * Concurrent first contacts race on the store's unique constraint; losers re-read and adopt the
 * winner's id.
 */
@Slf4j
@Component
public class DatabaseThreadIdStrategy implements ThreadIdStrategy {

    private final MappingStore mappingStore;
    private final ScopeKeyFactory scopeKeyFactory;
    private final StoreCallExecutor storeCallExecutor;
    private final MappingEventPublisher eventPublisher;
    private final String threadIdPrefix;
    private final int maxCreateAttempts;

    public DatabaseThreadIdStrategy(
            MappingStore mappingStore,
            ScopeKeyFactory scopeKeyFactory,
            StoreCallExecutor storeCallExecutor,
            MappingEventPublisher eventPublisher,
            BridgeProperties bridgeProperties) {
        this.mappingStore = mappingStore;
        this.scopeKeyFactory = scopeKeyFactory;
        this.storeCallExecutor = storeCallExecutor;
        this.eventPublisher = eventPublisher;
        this.threadIdPrefix = bridgeProperties.getDatabase().getThreadIdPrefix();
        this.maxCreateAttempts = bridgeProperties.getDatabase().getMaxCreateAttempts();
    }

    @Override
    public MappingStrategy getStrategy() {
        return MappingStrategy.DATABASE;
    }

    @Override
    public ThreadResolution resolve(ConversationContext context) {
        String scopeKey = scopeKeyFactory.scopeKey(context);
        String tenantId = context.getTenantId();

        for (int attempt = 1; attempt <= maxCreateAttempts; attempt++) {
            Optional<ThreadMapping> existing =
                    storeCallExecutor.call("findByScopeKey", () -> mappingStore.findByScopeKey(tenantId, scopeKey));
            if (existing.isPresent()) {
                ThreadMapping mapping = existing.get();
                storeCallExecutor.fireAndForget("touch", () -> mappingStore.touch(mapping.getThreadId()));
                return resolution(mapping, false);
            }

            String candidate = newThreadId();
            try {
                ThreadMapping created =
                        storeCallExecutor.call("create", () -> mappingStore.create(scopeKey, candidate, context));
                log.debug("Created thread {} for tenant {} ({})", created.getThreadId(), tenantId,
                        context.getConversationType());
                eventPublisher.publish(MappingEventType.MAPPING_CREATED, created);
                return resolution(created, true);
            } catch (StoreConflictException ex) {
                log.debug("Lost creation race for tenant {} on attempt {}, re-reading", tenantId, attempt);
            }
        }

        throw new StoreUnavailableException(
                "Mapping for tenant " + tenantId + " could not be settled after " + maxCreateAttempts + " attempts");
    }

    @Override
    public Optional<ConversationContext> lookupContext(String threadId) {
        return storeCallExecutor.call("findByThreadId", () -> mappingStore.findByThreadId(threadId))
                .map(ThreadMapping::toConversationContext);
    }

    String newThreadId() {
        return threadIdPrefix + "-" + UUID.randomUUID().toString().replace("-", "");
    }

    private ThreadResolution resolution(ThreadMapping mapping, boolean created) {
        return ThreadResolution.builder()
                .threadId(mapping.getThreadId())
                .strategy(MappingStrategy.DATABASE)
                .created(created)
                .scopeKey(mapping.getScopeKey())
                .createdAt(mapping.getCreatedAt())
                .lastActivityAt(mapping.getLastActivityAt())
                .build();
    }
}
