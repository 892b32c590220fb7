package com.example.agentmetrics.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ContentEvent implements MetricEvent {
    String contentId;
    String contentType;
    String messageContent;
    Long agentId;
    String agentName;
    String sessionId;
    Instant timestamp;

    @Override
    public EventCategory category() {
        return EventCategory.CONTENT;
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
