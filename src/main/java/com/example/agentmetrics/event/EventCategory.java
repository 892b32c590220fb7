package com.example.agentmetrics.event;

/**
 * Category tag of a metric event. Each category has its own queue and its own worker loop.
 */
public enum EventCategory {
    EXECUTION("execution"),
    CONTENT("content"),
    SESSION("session"),
    CLASSIFICATION("classification");

    private final String key;

    EventCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
