package com.example.bridge.event;

public interface MappingEventListener {

    void onMappingEvent(MappingEvent event);
}
