package com.example.bridge.persistence;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ThreadMapping;
import com.example.bridge.service.MappingStore;
import com.example.bridge.service.exception.StoreConflictException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Relational mapping store. The unique constraint on {@code (tenant_id, scope_key)} and the
 * primary key on {@code thread_id} make concurrent creation safe without explicit locking.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "bridge.database", name = "backend", havingValue = "jpa", matchIfMissing = true)
public class JpaThreadMappingStore implements MappingStore {

    // SQL standard class 23, unique_violation
    private static final String UNIQUE_VIOLATION_STATE = "23505";

    private final ThreadMappingJpaRepository jpaRepository;
    private final ThreadMappingEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<ThreadMapping> findByScopeKey(String tenantId, String scopeKey) {
        return jpaRepository.findByTenantIdAndScopeKey(tenantId, scopeKey).map(mapper::toMapping);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ThreadMapping> findByThreadId(String threadId) {
        if (!StringUtils.hasText(threadId)) {
            return Optional.empty();
        }
        return jpaRepository.findById(threadId).map(mapper::toMapping);
    }

    @Override
    @Transactional
    public ThreadMapping create(String scopeKey, String threadId, ConversationContext context) {
        Instant now = now();
        ThreadMapping mapping = ThreadMapping.builder()
                .threadId(threadId)
                .scopeKey(scopeKey)
                .tenantId(context.getTenantId())
                .conversationType(context.getConversationType())
                .channelConversationId(context.getChannelConversationId())
                .channelUserId(context.getChannelUserId())
                .metadata(context.getMetadata())
                .createdAt(now)
                .lastActivityAt(now)
                .active(true)
                .build();
        try {
            jpaRepository.saveAndFlush(mapper.toEntity(mapping));
        } catch (DataIntegrityViolationException ex) {
            if (isUniqueViolation(ex)) {
                throw new StoreConflictException(scopeKey, ex);
            }
            throw ex;
        }
        return mapping;
    }

    /**
     * Only a duplicate scope key or thread id is a lost creation race. NOT NULL, length and other
     * integrity failures are left to propagate.
     */
    static boolean isUniqueViolation(DataIntegrityViolationException ex) {
        if (ex instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && ThreadMappingEntity.SCOPE_CONSTRAINT.equalsIgnoreCase(violation.getConstraintName())) {
                return true;
            }
            if (cause instanceof SQLException sqlException
                    && UNIQUE_VIOLATION_STATE.equals(sqlException.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    @Override
    @Transactional
    public void touch(String threadId) {
        jpaRepository.touch(threadId, now());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ThreadMapping> findInactive(Instant olderThan, int limit) {
        if (olderThan == null || limit <= 0) {
            return Collections.emptyList();
        }
        return jpaRepository.findByLastActivityAtBeforeOrderByLastActivityAtAsc(olderThan, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toMapping)
                .toList();
    }

    @Override
    @Transactional
    public boolean deleteIfInactive(String threadId, Instant olderThan) {
        return jpaRepository.deleteIfInactive(threadId, olderThan) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ThreadMapping> findActiveByTenant(String tenantId, int limit) {
        if (!StringUtils.hasText(tenantId) || limit <= 0) {
            return Collections.emptyList();
        }
        return jpaRepository.findByTenantIdAndActiveTrueOrderByLastActivityAtDesc(tenantId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toMapping)
                .toList();
    }

    @Override
    @Transactional
    public boolean deactivate(String threadId) {
        return jpaRepository.deactivate(threadId) > 0;
    }

    @Override
    @Transactional
    public boolean release(String threadId) {
        return jpaRepository.release(threadId) > 0;
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
