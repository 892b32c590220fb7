package com.example.agentmetrics.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SessionActivityRecord {
    String sessionId;
    String userId;
    Long agentId;
    Long teamId;
    Instant startTime;
    int messageCount;
    Instant lastActivity;
}
