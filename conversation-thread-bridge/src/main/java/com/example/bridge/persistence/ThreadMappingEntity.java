package com.example.bridge.persistence;

import com.example.bridge.domain.ConversationType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "thread_mappings",
        uniqueConstraints = @UniqueConstraint(
                name = ThreadMappingEntity.SCOPE_CONSTRAINT,
                columnNames = {"tenant_id", "scope_key"}),
        indexes = @Index(name = "idx_thread_mappings_last_activity", columnList = "last_activity_at"))
public class ThreadMappingEntity {

    static final String SCOPE_CONSTRAINT = "uk_thread_mappings_tenant_scope";

    @Id
    @Column(name = "thread_id", nullable = false, updatable = false, length = 128)
    private String threadId;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 128)
    private String tenantId;

    @Column(name = "scope_key", nullable = false, updatable = false, length = 1024)
    private String scopeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "conversation_type", nullable = false, length = 32)
    private ConversationType conversationType;

    @Column(name = "channel_conversation_id", length = 512)
    private String channelConversationId;

    @Column(name = "channel_user_id", length = 256)
    private String channelUserId;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Version
    @Column(name = "version")
    private Long version;
}
