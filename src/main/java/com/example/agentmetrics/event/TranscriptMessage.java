package com.example.agentmetrics.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class TranscriptMessage {
    String sender;
    String content;
    Instant timestamp;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
