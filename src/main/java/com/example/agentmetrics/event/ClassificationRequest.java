package com.example.agentmetrics.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Request to classify a finished conversation. The transcript is ordered oldest first.
 */
@Value
@Builder
@Jacksonized
public class ClassificationRequest implements MetricEvent {
    String requestId;
    String sessionId;
    @Builder.Default
    List<TranscriptMessage> messages = List.of();
    int totalMessages;
    TriggerReason triggerReason;
    String userId;
    Long agentId;
    Long teamId;
    Instant timestamp;

    @Override
    public EventCategory category() {
        return EventCategory.CLASSIFICATION;
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
