package com.example.agentmetrics.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Envelope stored in the broker list of its category.
 */
@Value
@Builder
@Jacksonized
public class QueueMessage {
    EventCategory category;
    Instant enqueuedAt;
    MetricEvent event;
}
