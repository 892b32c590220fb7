package com.example.agentmetrics.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Telemetry produced by the platform. Immutable once created; consumed and discarded
 * after it is persisted or dropped.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExecutionEvent.class, name = "execution"),
        @JsonSubTypes.Type(value = ContentEvent.class, name = "content"),
        @JsonSubTypes.Type(value = SessionEvent.class, name = "session"),
        @JsonSubTypes.Type(value = ClassificationRequest.class, name = "classification")
})
public sealed interface MetricEvent permits ExecutionEvent, ContentEvent, SessionEvent, ClassificationRequest {

    EventCategory category();

    String sessionId();

    Instant timestamp();
}
