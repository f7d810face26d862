package com.example.bridge.persistence.mongo;

import com.example.bridge.domain.ConversationType;
import com.example.bridge.domain.ThreadMapping;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Sharded;

/**
 * Thread mapping as stored in MongoDB. Partitioned by tenant; the unique compound index on
 * {@code (tenantId, scopeKey)} carries the one-mapping-per-scope guarantee and includes the shard
 * key as required for unique indexes on sharded collections.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = MongoThreadMappingStore.COLLECTION)
@Sharded(shardKey = {"tenantId"})
@CompoundIndexes({
    @CompoundIndex(name = "tenant_scope_uidx", def = "{'tenantId': 1, 'scopeKey': 1}", unique = true),
    @CompoundIndex(name = "tenant_active_activity_idx", def = "{'tenantId': 1, 'active': 1, 'lastActivityAt': -1}")
})
public class ThreadMappingDocument {

    @Id
    private String threadId;

    private String tenantId;
    private String scopeKey;
    private ConversationType conversationType;
    private String channelConversationId;
    private String channelUserId;
    private Map<String, String> metadata;
    private Instant createdAt;

    @Indexed(name = "last_activity_idx")
    private Instant lastActivityAt;

    private boolean active;

    static ThreadMappingDocument from(ThreadMapping mapping) {
        return ThreadMappingDocument.builder()
                .threadId(mapping.getThreadId())
                .tenantId(mapping.getTenantId())
                .scopeKey(mapping.getScopeKey())
                .conversationType(mapping.getConversationType())
                .channelConversationId(mapping.getChannelConversationId())
                .channelUserId(mapping.getChannelUserId())
                .metadata(mapping.getMetadata())
                .createdAt(mapping.getCreatedAt())
                .lastActivityAt(mapping.getLastActivityAt())
                .active(mapping.isActive())
                .build();
    }

    ThreadMapping toMapping() {
        return ThreadMapping.builder()
                .threadId(threadId)
                .tenantId(tenantId)
                .scopeKey(scopeKey)
                .conversationType(conversationType)
                .channelConversationId(channelConversationId)
                .channelUserId(channelUserId)
                .metadata(metadata != null ? metadata : Map.of())
                .createdAt(createdAt)
                .lastActivityAt(lastActivityAt)
                .active(active)
                .build();
    }
}
