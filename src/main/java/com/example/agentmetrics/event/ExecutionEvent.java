package com.example.agentmetrics.event;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExecutionEvent implements MetricEvent {
    Long agentId;
    String agentName;
    String model;
    long executionTimeMs;
    String inputText;
    String outputText;
    @With
    Integer inputTokens;
    @With
    Integer outputTokens;
    @With
    Double costEstimate;
    @Builder.Default
    List<String> toolsUsed = List.of();
    String sessionId;
    @Builder.Default
    boolean success = true;
    @Builder.Default
    String operationType = "chat";
    Instant timestamp;

    @Override
    public EventCategory category() {
        return EventCategory.EXECUTION;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public Instant timestamp() {
        return timestamp;
    }

    public int totalTokens() {
        return (inputTokens == null ? 0 : inputTokens) + (outputTokens == null ? 0 : outputTokens);
    }
}
