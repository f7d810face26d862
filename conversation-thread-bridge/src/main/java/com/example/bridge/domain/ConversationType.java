package com.example.bridge.domain;

import java.util.Locale;
import java.util.Optional;

public enum ConversationType {

    PERSONAL("personal"),
    GROUP("shared"),
    CHANNEL_THREAD("shared");

    private final String scopeSegment;

    ConversationType(String scopeSegment) {
        this.scopeSegment = scopeSegment;
    }

    /**
     * Segment used when building the scope key. Group chats and channel threads share one
     * segment because both are keyed on the conversation rather than on the user.
     */
    public String getScopeSegment() {
        return scopeSegment;
    }

    public boolean isShared() {
        return this != PERSONAL;
    }

    /**
     * Parses the spellings channels commonly send ({@code personal}, {@code groupChat},
     * {@code channel}, ...).
     */
    public static Optional<ConversationType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return switch (normalized) {
            case "personal" -> Optional.of(PERSONAL);
            case "group", "groupchat" -> Optional.of(GROUP);
            case "channel", "channelthread" -> Optional.of(CHANNEL_THREAD);
            default -> Optional.empty();
        };
    }
}
