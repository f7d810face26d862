package com.example.bridge.service.strategy;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadResolution;
import java.util.Optional;

/**
 * One way of turning a validated conversation context into a workflow thread id.
 */
public interface ThreadIdStrategy {

    MappingStrategy getStrategy();

    ThreadResolution resolve(ConversationContext context);

    /**
     * Rebuilds the conversation context behind a thread id. Only strategies that keep durable
     * state can answer.
     */
    default Optional<ConversationContext> lookupContext(String threadId) {
        return Optional.empty();
    }
}
