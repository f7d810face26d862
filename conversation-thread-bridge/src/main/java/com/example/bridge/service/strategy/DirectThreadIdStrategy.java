package com.example.bridge.service.strategy;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadResolution;
import org.springframework.stereotype.Component;

/**
 * Uses the channel conversation id as thread id. Continuity across devices holds only as far as
 * the channel keeps that id stable.
 */
@Component
public class DirectThreadIdStrategy implements ThreadIdStrategy {

    @Override
    public MappingStrategy getStrategy() {
        return MappingStrategy.DIRECT;
    }

    @Override
    public ThreadResolution resolve(ConversationContext context) {
        return ThreadResolution.builder()
                .threadId(context.getChannelConversationId())
                .strategy(MappingStrategy.DIRECT)
                .build();
    }
}
