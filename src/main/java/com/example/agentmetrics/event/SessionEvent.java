package com.example.agentmetrics.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class SessionEvent implements MetricEvent {
    String sessionId;
    String userId;
    Long agentId;
    Long teamId;
    @Builder.Default
    int messageCount = 1;
    long durationSeconds;
    Instant timestamp;

    @Override
    public EventCategory category() {
        return EventCategory.SESSION;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public Instant timestamp() {
        return timestamp;
    }
}
