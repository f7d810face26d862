package com.example.bridge.service;

import com.example.bridge.domain.ThreadMapping;
import com.example.bridge.event.MappingEventPublisher;
import com.example.bridge.event.MappingEventType;
import com.example.bridge.service.exception.ServiceException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Administrative operations on stored mappings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreadMappingService {

    static final int MAX_LIST_LIMIT = 500;

    private final MappingStore mappingStore;
    private final StoreCallExecutor storeCallExecutor;
    private final MappingEventPublisher eventPublisher;

    public List<ThreadMapping> listActive(String tenantId, int limit) {
        if (!StringUtils.hasText(tenantId)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "tenantId is required", "invalid_request");
        }
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new ServiceException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + MAX_LIST_LIMIT, "invalid_request");
        }
        return storeCallExecutor.call("findActiveByTenant", () -> mappingStore.findActiveByTenant(tenantId, limit));
    }

    /**
     * Marks the mapping inactive. The next message on the conversation reactivates it with the same
     * thread id.
     */
    public void deactivate(String threadId) {
        ThreadMapping mapping = require(threadId);
        boolean updated = storeCallExecutor.call("deactivate", () -> mappingStore.deactivate(threadId));
        if (!updated) {
            throw notFound(threadId);
        }
        mapping.setActive(false);
        log.info("Deactivated thread {} for tenant {}", threadId, mapping.getTenantId());
        eventPublisher.publish(MappingEventType.MAPPING_DEACTIVATED, mapping);
    }

    /**
     * Deletes the mapping so that the next message on the conversation starts a fresh thread. The
     * released thread id is never handed out again.
     */
    public void release(String threadId) {
        ThreadMapping mapping = require(threadId);
        boolean deleted = storeCallExecutor.call("release", () -> mappingStore.release(threadId));
        if (!deleted) {
            throw notFound(threadId);
        }
        log.info("Released thread {} for tenant {}", threadId, mapping.getTenantId());
        eventPublisher.publish(MappingEventType.MAPPING_RELEASED, mapping);
    }

    private ThreadMapping require(String threadId) {
        return storeCallExecutor.call("findByThreadId", () -> mappingStore.findByThreadId(threadId))
                .orElseThrow(() -> notFound(threadId));
    }

    private ServiceException notFound(String threadId) {
        return new ServiceException(HttpStatus.NOT_FOUND, "No mapping for thread " + threadId, "mapping_not_found");
    }
}
