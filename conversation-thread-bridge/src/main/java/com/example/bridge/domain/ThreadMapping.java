package com.example.bridge.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadMapping implements Serializable {

    private String threadId;
    private String scopeKey;
    private String tenantId;
    private ConversationType conversationType;
    private String channelConversationId;
    private String channelUserId;
    private Map<String, String> metadata;
    private Instant createdAt;
    private Instant lastActivityAt;
    private boolean active;

    public ConversationContext toConversationContext() {
        return ConversationContext.builder()
                .channelConversationId(channelConversationId)
                .channelUserId(channelUserId)
                .conversationType(conversationType)
                .tenantId(tenantId)
                .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
                .build();
    }
}
