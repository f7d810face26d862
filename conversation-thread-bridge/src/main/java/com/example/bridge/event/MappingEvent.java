package com.example.bridge.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingEvent implements Serializable {

    private String eventId;
    private MappingEventType type;
    private String threadId;
    private String tenantId;
    private Instant occurredAt;
    private Map<String, Object> payload;
}
