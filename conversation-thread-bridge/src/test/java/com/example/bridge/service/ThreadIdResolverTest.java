package com.example.bridge.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ConversationType;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadResolution;
import com.example.bridge.service.strategy.DirectThreadIdStrategy;
import com.example.bridge.service.strategy.HashThreadIdStrategy;
import java.util.List;
import org.junit.jupiter.api.Test;

class ThreadIdResolverTest {

    private final ConversationContext context = ConversationContext.builder()
            .channelConversationId("a:1Xyz-conversation")
            .channelUserId("user-1")
            .conversationType(ConversationType.GROUP)
            .tenantId("tenant-1")
            .build();

    private final ThreadIdResolver resolver = new ThreadIdResolver(List.of(
            new DirectThreadIdStrategy(),
            new HashThreadIdStrategy(new ScopeKeyFactory(), new BridgeProperties())));

    @Test
    void directStrategyReturnsChannelConversationId() {
        ThreadResolution resolution = resolver.resolve(context, MappingStrategy.DIRECT);

        assertEquals("a:1Xyz-conversation", resolution.getThreadId());
        assertEquals(MappingStrategy.DIRECT, resolution.getStrategy());
        assertNull(resolution.getScopeKey());
    }

    @Test
    void dispatchesToHashStrategy() {
        ThreadResolution resolution = resolver.resolve(context, MappingStrategy.HASH);

        assertTrue(resolution.getThreadId().startsWith("thread-"));
        assertEquals("tenant-1|shared|a:1Xyz-conversation", resolution.getScopeKey());
    }

    @Test
    void statelessStrategiesHaveNoReverseLookup() {
        assertTrue(resolver.lookupContext("thread-0123456789abcdef", MappingStrategy.HASH).isEmpty());
        assertTrue(resolver.lookupContext("a:1Xyz-conversation", MappingStrategy.DIRECT).isEmpty());
    }

    @Test
    void failsForUnregisteredStrategy() {
        assertThrows(IllegalStateException.class, () -> resolver.resolve(context, MappingStrategy.DATABASE));
    }

    @Test
    void rejectsDuplicateRegistrations() {
        assertThrows(IllegalStateException.class,
                () -> new ThreadIdResolver(List.of(new DirectThreadIdStrategy(), new DirectThreadIdStrategy())));
    }
}
