package com.example.bridge.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ThreadResolution {

    String threadId;
    MappingStrategy strategy;

    /**
     * True only when this call created the durable mapping.
     */
    boolean created;

    String scopeKey;
    Instant createdAt;
    /**
     * Activity time held by the store before this message. Equals {@link #createdAt} for a newly
     * created mapping. The touch for the current message is applied asynchronously and is not
     * reflected here.
     */
    Instant lastActivityAt;
}
