package com.example.bridge.domain;

import java.io.Serializable;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized channel identity of one inbound message. Only the four identity fields take part in
 * thread id derivation; {@link #metadata} is carried along untouched.
 */
@Value
@Builder(toBuilder = true)
public class ConversationContext implements Serializable {

    public static final String USER_NAME = "userName";
    public static final String CHANNEL_ID = "channelId";
    public static final String SERVICE_URL = "serviceUrl";

    String channelConversationId;
    String channelUserId;
    ConversationType conversationType;
    String tenantId;

    @Builder.Default
    Map<String, String> metadata = Map.of();
}
