package com.example.bridge.persistence;

import com.example.bridge.domain.ThreadMapping;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class ThreadMappingEntityMapper {

    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ThreadMappingEntity toEntity(ThreadMapping mapping) {
        ThreadMappingEntity entity = new ThreadMappingEntity();
        entity.setThreadId(mapping.getThreadId());
        entity.setTenantId(mapping.getTenantId());
        entity.setScopeKey(mapping.getScopeKey());
        entity.setConversationType(mapping.getConversationType());
        entity.setChannelConversationId(mapping.getChannelConversationId());
        entity.setChannelUserId(mapping.getChannelUserId());
        entity.setMetadata(writeJson(mapping.getMetadata()));
        entity.setCreatedAt(mapping.getCreatedAt());
        entity.setLastActivityAt(mapping.getLastActivityAt());
        entity.setActive(mapping.isActive());
        return entity;
    }

    public ThreadMapping toMapping(ThreadMappingEntity entity) {
        if (entity == null) {
            return null;
        }
        return ThreadMapping.builder()
                .threadId(entity.getThreadId())
                .tenantId(entity.getTenantId())
                .scopeKey(entity.getScopeKey())
                .conversationType(entity.getConversationType())
                .channelConversationId(entity.getChannelConversationId())
                .channelUserId(entity.getChannelUserId())
                .metadata(readMap(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .lastActivityAt(entity.getLastActivityAt())
                .active(entity.isActive())
                .build();
    }

    private String writeJson(Map<String, String> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize mapping metadata", e);
        }
    }

    private Map<String, String> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable mapping metadata: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
