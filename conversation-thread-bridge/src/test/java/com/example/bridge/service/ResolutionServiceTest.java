package com.example.bridge.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ConversationType;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadResolution;
import com.example.bridge.dto.InboundActivity;
import com.example.bridge.event.MappingEventPublisher;
import com.example.bridge.service.exception.ContextValidationException;
import com.example.bridge.service.exception.StoreUnavailableException;
import com.example.bridge.service.strategy.DatabaseThreadIdStrategy;
import com.example.bridge.service.strategy.DirectThreadIdStrategy;
import com.example.bridge.service.strategy.HashThreadIdStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class ResolutionServiceTest {

    private final BridgeProperties properties = new BridgeProperties();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    private ResolutionService service(MappingStore store) {
        ScopeKeyFactory scopeKeyFactory = new ScopeKeyFactory();
        StoreCallExecutor executor = new StoreCallExecutor(Runnable::run, Duration.ofSeconds(1));
        ThreadIdResolver resolver = new ThreadIdResolver(List.of(
                new DirectThreadIdStrategy(),
                new HashThreadIdStrategy(scopeKeyFactory, properties),
                new DatabaseThreadIdStrategy(store, scopeKeyFactory, executor, mock(MappingEventPublisher.class),
                        properties)));
        return new ResolutionService(new ConversationContextValidator(properties, new ObjectMapper()), resolver, properties);
    }

    private static InboundActivity activity(String conversationId, String userId, String type, String tenantId) {
        return InboundActivity.builder()
                .conversationId(conversationId)
                .aadObjectId(userId)
                .userId("29:" + conversationId)
                .conversationType(type)
                .tenantId(tenantId)
                .build();
    }

    @Test
    void sameUserFromTwoConversationsResolvesToOneThread() {
        ResolutionService service = service(new InMemoryMappingStore(clock));

        String first = service.resolveThreadId(activity("conv-a", "user-u", "personal", "tenant-t"));
        String second = service.resolveThreadId(activity("conv-b", "user-u", "personal", "tenant-t"));

        assertEquals(first, second);
    }

    @Test
    void groupMembersShareThread() {
        ResolutionService service = service(new InMemoryMappingStore(clock));

        String alice = service.resolveThreadId(activity("group-1", "alice", "groupChat", "tenant-t"));
        String bob = service.resolveThreadId(activity("group-1", "bob", "groupChat", "tenant-t"));
        String alicePersonal = service.resolveThreadId(activity("dm-alice", "alice", "personal", "tenant-t"));

        assertEquals(alice, bob);
        assertNotEquals(alice, alicePersonal);
    }

    @Test
    void tenantsAreIsolatedForEveryStrategy() {
        for (MappingStrategy strategy : List.of(MappingStrategy.HASH, MappingStrategy.DATABASE)) {
            properties.setStrategy(strategy);
            ResolutionService service = service(new InMemoryMappingStore(clock));

            assertNotEquals(
                    service.resolveThreadId(activity("conv-a", "user-u", "personal", "tenant-1")),
                    service.resolveThreadId(activity("conv-a", "user-u", "personal", "tenant-2")),
                    strategy.name());
        }
    }

    @Test
    void databaseStrategyReportsCreationOnce() {
        properties.setStrategy(MappingStrategy.DATABASE);
        ResolutionService service = service(new InMemoryMappingStore(clock));

        ThreadResolution first = service.resolve(activity("conv-a", "user-u", "personal", "tenant-t"));
        ThreadResolution second = service.resolve(activity("conv-b", "user-u", "personal", "tenant-t"));

        assertTrue(first.isCreated());
        assertEquals(first.getThreadId(), second.getThreadId());
        assertEquals(MappingStrategy.DATABASE, second.getStrategy());
    }

    @Test
    void invalidActivityNeverReachesResolver() {
        ThreadIdResolver resolver = mock(ThreadIdResolver.class);
        ResolutionService service =
                new ResolutionService(new ConversationContextValidator(properties, new ObjectMapper()), resolver, properties);

        InboundActivity anonymous = InboundActivity.builder()
                .conversationId("conv-a")
                .conversationType("personal")
                .tenantId("tenant-t")
                .build();

        assertThrows(ContextValidationException.class, () -> service.resolve(anonymous));
        verifyNoInteractions(resolver);
    }

    @Test
    void prebuiltContextWithoutTenantIsRejectedBeforeResolution() {
        ThreadIdResolver resolver = mock(ThreadIdResolver.class);
        ResolutionService service =
                new ResolutionService(new ConversationContextValidator(properties, new ObjectMapper()), resolver, properties);
        ConversationContext noTenant = ConversationContext.builder()
                .channelConversationId("conv-a")
                .channelUserId("user-u")
                .conversationType(ConversationType.PERSONAL)
                .build();

        ContextValidationException ex =
                assertThrows(ContextValidationException.class, () -> service.resolve(noTenant));

        assertEquals(List.of("tenantId is required"), ex.getViolations());
        verifyNoInteractions(resolver);
    }

    @Test
    void directStrategyNeverReturnsMissingThreadId() {
        properties.setStrategy(MappingStrategy.DIRECT);
        ResolutionService service = service(new InMemoryMappingStore(clock));
        ConversationContext noConversation = ConversationContext.builder()
                .channelUserId("user-u")
                .conversationType(ConversationType.GROUP)
                .tenantId("tenant-t")
                .build();

        assertThrows(ContextValidationException.class, () -> service.resolve(noConversation));
    }

    @Test
    void unavailableStorePropagatesByDefault() {
        properties.setStrategy(MappingStrategy.DATABASE);
        MappingStore store = mock(MappingStore.class);
        when(store.findByScopeKey(anyString(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("down"));
        ResolutionService service = service(store);

        assertThrows(StoreUnavailableException.class,
                () -> service.resolve(activity("conv-a", "user-u", "personal", "tenant-t")));
    }

    @Test
    void unavailableStoreFallsBackToHashWhenConfigured() {
        properties.setStrategy(MappingStrategy.DATABASE);
        properties.getDatabase().setFallbackToHash(true);
        MappingStore store = mock(MappingStore.class);
        when(store.findByScopeKey(anyString(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("down"));
        ResolutionService service = service(store);

        ThreadResolution resolution = service.resolve(activity("conv-a", "user-u", "personal", "tenant-t"));

        assertEquals(MappingStrategy.HASH, resolution.getStrategy());
        properties.setStrategy(MappingStrategy.HASH);
        assertEquals(service(store).resolveThreadId(activity("conv-a", "user-u", "personal", "tenant-t")),
                resolution.getThreadId());
    }

    @Test
    void reverseLookupFollowsConfiguredStrategy() {
        properties.setStrategy(MappingStrategy.DATABASE);
        ResolutionService service = service(new InMemoryMappingStore(clock));
        String threadId = service.resolveThreadId(activity("conv-a", "user-u", "personal", "tenant-t"));

        assertEquals("user-u", service.lookupContext(threadId).orElseThrow().getChannelUserId());
        assertTrue(service.lookupContext(" ").isEmpty());

        properties.setStrategy(MappingStrategy.HASH);
        assertTrue(service.lookupContext(threadId).isEmpty());
    }
}
