package com.example.bridge.service;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ConversationType;
import com.example.bridge.dto.InboundActivity;
import com.example.bridge.service.exception.ContextValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns an {@link InboundActivity} into a {@link ConversationContext}, rejecting it with every
 * violation listed when one of the identity fields cannot be established.
 */
@Slf4j
@Component
public class ConversationContextValidator {

    static final int MAX_CONVERSATION_ID_LENGTH = 512;
    static final int MAX_USER_ID_LENGTH = 256;
    static final int MAX_TENANT_ID_LENGTH = 128;

    private final boolean multiTenant;
    private final String defaultTenantId;
    private final ObjectMapper objectMapper;

    public ConversationContextValidator(BridgeProperties bridgeProperties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.multiTenant = bridgeProperties.isMultiTenant();
        this.defaultTenantId = bridgeProperties.getDefaultTenantId();
        if (!multiTenant && !StringUtils.hasText(defaultTenantId)) {
            throw new IllegalStateException(
                    "bridge.default-tenant-id must be set when bridge.multi-tenant is false");
        }
        if (!multiTenant) {
            log.info("Single-tenant mode: activities without a tenant resolve under '{}'", defaultTenantId);
        }
    }

    public ConversationContext validate(InboundActivity activity) {
        if (activity == null) {
            throw new ContextValidationException(List.of("activity is required"));
        }
        List<String> violations = new ArrayList<>();

        String conversationId = trimToNull(activity.getConversationId());
        if (conversationId == null) {
            violations.add("conversationId is required");
        } else {
            checkLength(violations, "conversationId", conversationId, MAX_CONVERSATION_ID_LENGTH);
        }

        String userId = trimToNull(activity.getAadObjectId());
        if (userId == null) {
            userId = trimToNull(activity.getUserId());
        }
        if (userId == null) {
            violations.add("aadObjectId or userId is required");
        } else {
            checkLength(violations, "userId", userId, MAX_USER_ID_LENGTH);
        }

        ConversationType conversationType = null;
        String rawType = trimToNull(activity.getConversationType());
        if (rawType == null) {
            violations.add("conversationType is required");
        } else {
            Optional<ConversationType> parsed = ConversationType.fromValue(rawType);
            if (parsed.isEmpty()) {
                violations.add("conversationType '" + rawType + "' is not supported");
            } else {
                conversationType = parsed.get();
            }
        }

        String tenantId = trimToNull(activity.getTenantId());
        if (tenantId == null) {
            if (multiTenant) {
                violations.add("tenantId is required");
            } else {
                tenantId = defaultTenantId;
            }
        }
        if (tenantId != null) {
            checkLength(violations, "tenantId", tenantId, MAX_TENANT_ID_LENGTH);
        }

        if (!violations.isEmpty()) {
            throw new ContextValidationException(violations);
        }

        return ConversationContext.builder()
                .channelConversationId(conversationId)
                .channelUserId(userId)
                .conversationType(conversationType)
                .tenantId(tenantId)
                .metadata(metadata(activity))
                .build();
    }

    /**
     * Checks a context built outside {@link #validate(InboundActivity)} against the same identity
     * rules, without applying any defaults.
     */
    public ConversationContext requireComplete(ConversationContext context) {
        if (context == null) {
            throw new ContextValidationException(List.of("context is required"));
        }
        List<String> violations = new ArrayList<>();
        if (!StringUtils.hasText(context.getChannelConversationId())) {
            violations.add("conversationId is required");
        } else {
            checkLength(violations, "conversationId", context.getChannelConversationId(), MAX_CONVERSATION_ID_LENGTH);
        }
        if (!StringUtils.hasText(context.getChannelUserId())) {
            violations.add("aadObjectId or userId is required");
        } else {
            checkLength(violations, "userId", context.getChannelUserId(), MAX_USER_ID_LENGTH);
        }
        if (context.getConversationType() == null) {
            violations.add("conversationType is required");
        }
        if (!StringUtils.hasText(context.getTenantId())) {
            violations.add("tenantId is required");
        } else {
            checkLength(violations, "tenantId", context.getTenantId(), MAX_TENANT_ID_LENGTH);
        }
        if (!violations.isEmpty()) {
            throw new ContextValidationException(violations);
        }
        return context;
    }

    private void checkLength(List<String> violations, String field, String value, int max) {
        if (value.length() > max) {
            violations.add(field + " must be at most " + max + " characters");
        }
    }

    private Map<String, String> metadata(InboundActivity activity) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (activity.getExtra() != null) {
            activity.getExtra().forEach((key, value) -> {
                if (key != null && value != null) {
                    metadata.put(key, metadataValue(key, value));
                }
            });
        }
        putIfPresent(metadata, ConversationContext.USER_NAME, activity.getUserName());
        putIfPresent(metadata, ConversationContext.CHANNEL_ID, activity.getChannelId());
        putIfPresent(metadata, ConversationContext.SERVICE_URL, activity.getServiceUrl());
        return Map.copyOf(metadata);
    }

    private String metadataValue(String key, Object value) {
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new ContextValidationException(List.of("extra property '" + key + "' cannot be serialized"));
        }
    }

    private void putIfPresent(Map<String, String> metadata, String key, String value) {
        if (StringUtils.hasText(value)) {
            metadata.put(key, value);
        }
    }

    private String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
