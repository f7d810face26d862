package com.example.bridge.persistence.mongo;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ThreadMapping;
import com.example.bridge.service.MappingStore;
import com.example.bridge.service.exception.StoreConflictException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "bridge.database", name = "backend", havingValue = "mongo")
public class MongoThreadMappingStore implements MappingStore {

    static final String COLLECTION = "thread_mappings";

    private static final String ID = "_id";
    private static final String TENANT_ID = "tenantId";
    private static final String SCOPE_KEY = "scopeKey";
    private static final String LAST_ACTIVITY_AT = "lastActivityAt";
    private static final String ACTIVE = "active";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public Optional<ThreadMapping> findByScopeKey(String tenantId, String scopeKey) {
        Query query = new Query(Criteria.where(TENANT_ID).is(tenantId).and(SCOPE_KEY).is(scopeKey));
        return Optional.ofNullable(mongoTemplate.findOne(query, ThreadMappingDocument.class, COLLECTION))
                .map(ThreadMappingDocument::toMapping);
    }

    @Override
    public Optional<ThreadMapping> findByThreadId(String threadId) {
        if (!StringUtils.hasText(threadId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(threadId, ThreadMappingDocument.class, COLLECTION))
                .map(ThreadMappingDocument::toMapping);
    }

    @Override
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
            mongoTemplate.insert(ThreadMappingDocument.from(mapping), COLLECTION);
        } catch (DuplicateKeyException ex) {
            throw new StoreConflictException(scopeKey, ex);
        }
        return mapping;
    }

    @Override
    public void touch(String threadId) {
        Instant now = now();
        Query query = new Query(Criteria.where(ID).is(threadId).and(LAST_ACTIVITY_AT).lt(now));
        Update update = new Update().set(LAST_ACTIVITY_AT, now).set(ACTIVE, true);
        mongoTemplate.updateFirst(query, update, ThreadMappingDocument.class, COLLECTION);
    }

    @Override
    public List<ThreadMapping> findInactive(Instant olderThan, int limit) {
        if (olderThan == null || limit <= 0) {
            return Collections.emptyList();
        }
        Query query = new Query(Criteria.where(LAST_ACTIVITY_AT).lt(olderThan))
                .with(Sort.by(Sort.Direction.ASC, LAST_ACTIVITY_AT))
                .limit(limit);
        return mongoTemplate.find(query, ThreadMappingDocument.class, COLLECTION).stream()
                .map(ThreadMappingDocument::toMapping)
                .toList();
    }

    @Override
    public boolean deleteIfInactive(String threadId, Instant olderThan) {
        Query query = new Query(Criteria.where(ID).is(threadId).and(LAST_ACTIVITY_AT).lt(olderThan));
        return mongoTemplate.remove(query, ThreadMappingDocument.class, COLLECTION).getDeletedCount() > 0;
    }

    @Override
    public List<ThreadMapping> findActiveByTenant(String tenantId, int limit) {
        if (!StringUtils.hasText(tenantId) || limit <= 0) {
            return Collections.emptyList();
        }
        Query query = new Query(Criteria.where(TENANT_ID).is(tenantId).and(ACTIVE).is(true))
                .with(Sort.by(Sort.Direction.DESC, LAST_ACTIVITY_AT))
                .limit(limit);
        return mongoTemplate.find(query, ThreadMappingDocument.class, COLLECTION).stream()
                .map(ThreadMappingDocument::toMapping)
                .toList();
    }

    @Override
    public boolean deactivate(String threadId) {
        Query query = new Query(Criteria.where(ID).is(threadId));
        return mongoTemplate.updateFirst(query, new Update().set(ACTIVE, false), ThreadMappingDocument.class, COLLECTION)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean release(String threadId) {
        Query query = new Query(Criteria.where(ID).is(threadId));
        boolean removed = mongoTemplate.remove(query, ThreadMappingDocument.class, COLLECTION).getDeletedCount() > 0;
        if (removed) {
            log.debug("Removed mapping document {}", threadId);
        }
        return removed;
    }

    private Instant now() {
        // BSON dates carry millisecond precision
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
