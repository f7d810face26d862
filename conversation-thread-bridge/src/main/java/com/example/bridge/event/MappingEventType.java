package com.example.bridge.event;

public enum MappingEventType {
    MAPPING_CREATED,
    MAPPING_DEACTIVATED,
    MAPPING_RELEASED,
    MAPPING_EXPIRED
}
