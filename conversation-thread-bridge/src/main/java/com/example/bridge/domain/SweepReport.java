package com.example.bridge.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SweepReport {

    long deleted;
    Instant startedAt;
    Instant completedAt;
    Instant deleteBound;

    /**
     * Set when another instance held the sweep lock and this run did nothing.
     */
    boolean skipped;

    public static SweepReport skipped(Instant at) {
        return SweepReport.builder()
                .deleted(0)
                .startedAt(at)
                .completedAt(at)
                .skipped(true)
                .build();
    }
}
