package com.example.bridge.event;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.config.StoreExecutorConfig;
import com.example.bridge.domain.ThreadMapping;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Fans mapping lifecycle events out to in-process listeners and, when enabled, to Kafka. Kafka
 * sends run on the event executor, since {@code KafkaTemplate.send} can block on broker metadata.
 * A failing listener or broker never fails the operation that raised the event.
 */
@Slf4j
@Component
public class MappingEventPublisher {

    private final ObjectProvider<MappingEventListener> listeners;
    private final KafkaTemplate<String, MappingEvent> mappingEventKafkaTemplate;
    private final BridgeProperties bridgeProperties;
    private final Clock clock;
    private final Executor eventExecutor;

    public MappingEventPublisher(ObjectProvider<MappingEventListener> listeners,
                                 KafkaTemplate<String, MappingEvent> mappingEventKafkaTemplate,
                                 BridgeProperties bridgeProperties,
                                 Clock clock,
                                 @Qualifier(StoreExecutorConfig.EVENT_EXECUTOR) Executor eventExecutor) {
        this.listeners = listeners;
        this.mappingEventKafkaTemplate = mappingEventKafkaTemplate;
        this.bridgeProperties = bridgeProperties;
        this.clock = clock;
        this.eventExecutor = eventExecutor;
    }

    public void publish(MappingEventType type, ThreadMapping mapping) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (mapping.getConversationType() != null) {
            payload.put("conversationType", mapping.getConversationType().name());
        }
        if (mapping.getLastActivityAt() != null) {
            payload.put("lastActivityAt", mapping.getLastActivityAt().toString());
        }
        publish(MappingEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .threadId(mapping.getThreadId())
                .tenantId(mapping.getTenantId())
                .occurredAt(Instant.now(clock))
                .payload(payload)
                .build());
    }

    public void publish(MappingEvent event) {
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onMappingEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Mapping event listener {} failed for {} on thread {}",
                        listener.getClass().getSimpleName(), event.getType(), event.getThreadId(), ex);
            }
        });

        if (!bridgeProperties.getEvents().isEnabled()) {
            return;
        }
        String topic = bridgeProperties.getEvents().getTopic();
        try {
            eventExecutor.execute(() -> send(topic, event));
        } catch (RejectedExecutionException ex) {
            log.warn("Event queue full, dropping {} for thread {}", event.getType(), event.getThreadId());
        }
    }

    private void send(String topic, MappingEvent event) {
        try {
            mappingEventKafkaTemplate
                    .send(topic, event.getThreadId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to deliver {} for thread {}", event.getType(), event.getThreadId(), ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} for thread {}", event.getType(), event.getThreadId(), ex);
        }
    }
}
