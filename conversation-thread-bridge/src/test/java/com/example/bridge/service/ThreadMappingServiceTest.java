package com.example.bridge.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.ConversationType;
import com.example.bridge.domain.ThreadMapping;
import com.example.bridge.event.MappingEventPublisher;
import com.example.bridge.event.MappingEventType;
import com.example.bridge.service.exception.ServiceException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ThreadMappingServiceTest {

    private MutableClock clock;
    private InMemoryMappingStore store;
    private MappingEventPublisher eventPublisher;
    private ThreadMappingService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-01T09:00:00Z"));
        store = new InMemoryMappingStore(clock);
        eventPublisher = mock(MappingEventPublisher.class);
        service = new ThreadMappingService(
                store, new StoreCallExecutor(Runnable::run, Duration.ofSeconds(1)), eventPublisher);
    }

    private String create(String tenantId, String userId) {
        ConversationContext context = ConversationContext.builder()
                .channelConversationId("conv-" + userId)
                .channelUserId(userId)
                .conversationType(ConversationType.PERSONAL)
                .tenantId(tenantId)
                .build();
        String threadId = "thread-" + tenantId + "-" + userId;
        store.create(tenantId + "|personal|" + userId, threadId, context);
        return threadId;
    }

    @Test
    void listsActiveMappingsOfTenantMostRecentFirst() {
        String older = create("tenant-1", "alice");
        clock.advance(Duration.ofMinutes(1));
        String newer = create("tenant-1", "bob");
        create("tenant-2", "carol");

        List<ThreadMapping> active = service.listActive("tenant-1", 10);

        assertEquals(List.of(newer, older), active.stream().map(ThreadMapping::getThreadId).toList());
    }

    @Test
    void rejectsOutOfRangeLimit() {
        ServiceException ex = assertThrows(ServiceException.class, () -> service.listActive("tenant-1", 0));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatus());
        assertThrows(ServiceException.class, () -> service.listActive("tenant-1", 501));
        assertThrows(ServiceException.class, () -> service.listActive(" ", 10));
    }

    @Test
    void deactivationHidesMappingFromActiveListing() {
        String threadId = create("tenant-1", "alice");

        service.deactivate(threadId);

        assertFalse(store.findByThreadId(threadId).orElseThrow().isActive());
        assertTrue(service.listActive("tenant-1", 10).isEmpty());
        verify(eventPublisher).publish(eq(MappingEventType.MAPPING_DEACTIVATED),
                argThat((ThreadMapping mapping) -> threadId.equals(mapping.getThreadId()) && !mapping.isActive()));
    }

    @Test
    void releaseDeletesMappingSoNextMessageStartsFresh() {
        String threadId = create("tenant-1", "alice");

        service.release(threadId);

        assertTrue(store.findByThreadId(threadId).isEmpty());
        assertTrue(store.findByScopeKey("tenant-1", "tenant-1|personal|alice").isEmpty());
        verify(eventPublisher).publish(eq(MappingEventType.MAPPING_RELEASED), any(ThreadMapping.class));
    }

    @Test
    void unknownThreadIsNotFound() {
        ServiceException deactivate = assertThrows(ServiceException.class, () -> service.deactivate("thread-missing"));
        ServiceException release = assertThrows(ServiceException.class, () -> service.release("thread-missing"));

        assertEquals(HttpStatus.NOT_FOUND, deactivate.getStatus());
        assertEquals("mapping_not_found", release.getErrorCode());
        verify(eventPublisher, never()).publish(any(MappingEventType.class), any(ThreadMapping.class));
    }
}
