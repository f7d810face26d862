package com.example.bridge.service;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadResolution;
import com.example.bridge.service.strategy.ThreadIdStrategy;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class ThreadIdResolver {

    private final Map<MappingStrategy, ThreadIdStrategy> strategies = new EnumMap<>(MappingStrategy.class);

    public ThreadIdResolver(List<ThreadIdStrategy> strategies) {
        for (ThreadIdStrategy strategy : strategies) {
            ThreadIdStrategy previous = this.strategies.put(strategy.getStrategy(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate thread id strategy for " + strategy.getStrategy());
            }
        }
    }

    public ThreadResolution resolve(ConversationContext context, MappingStrategy strategy) {
        return strategy(strategy).resolve(context);
    }

    public Optional<ConversationContext> lookupContext(String threadId, MappingStrategy strategy) {
        return strategy(strategy).lookupContext(threadId);
    }

    private ThreadIdStrategy strategy(MappingStrategy strategy) {
        ThreadIdStrategy resolved = strategies.get(strategy);
        if (resolved == null) {
            throw new IllegalStateException("No thread id strategy registered for " + strategy);
        }
        return resolved;
    }
}
