package com.example.bridge.service;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ConversationType;
import org.springframework.stereotype.Component;

/**
 * Builds the scope key identifying a logical conversation:
 * {@code tenant|personal|user} for one-to-one chats and {@code tenant|shared|conversation} for
 * group chats and channel threads. Components are escaped so that distinct tuples never render to
 * the same key.
 */
@Component
public class ScopeKeyFactory {

    static final char SEPARATOR = '|';
    private static final char ESCAPE = '\\';

    public String scopeKey(ConversationContext context) {
        ConversationType type = context.getConversationType();
        String subject = type.isShared() ? context.getChannelConversationId() : context.getChannelUserId();
        return escape(context.getTenantId()) + SEPARATOR + type.getScopeSegment() + SEPARATOR + escape(subject);
    }

    static String escape(String component) {
        StringBuilder escaped = new StringBuilder(component.length() + 8);
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (c == ESCAPE || c == SEPARATOR) {
                escaped.append(ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
