package com.example.bridge.service;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ThreadMapping;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of thread mappings, used by the database strategy and the lifecycle sweep.
 * Implementations guarantee that {@link #create} is atomic with respect to the
 * {@code (tenantId, scopeKey)} pair.
 */
public interface MappingStore {

    Optional<ThreadMapping> findByScopeKey(String tenantId, String scopeKey);

    Optional<ThreadMapping> findByThreadId(String threadId);

    /**
     * Inserts a new mapping with {@code createdAt == lastActivityAt == now}.
     *
     * @throws com.example.bridge.service.exception.StoreConflictException when a mapping for the
     *     scope key (or the thread id) already exists
     */
    ThreadMapping create(String scopeKey, String threadId, ConversationContext context);

    /**
     * Moves {@code lastActivityAt} to now, never backwards, and marks the mapping active.
     */
    void touch(String threadId);

    /**
     * Mappings whose last activity is strictly before {@code olderThan}, oldest first.
     */
    List<ThreadMapping> findInactive(Instant olderThan, int limit);

    /**
     * Deletes the mapping only if its last activity is still before {@code olderThan} at delete
     * time.
     */
    boolean deleteIfInactive(String threadId, Instant olderThan);

    List<ThreadMapping> findActiveByTenant(String tenantId, int limit);

    boolean deactivate(String threadId);

    boolean release(String threadId);
}
