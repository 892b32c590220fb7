package com.example.agentmetrics.service;

import com.example.agentmetrics.event.SessionEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process view of recently active chat sessions. Written by the ingestion session path
 * and the session worker, last write wins.
 */
@Component
public class SessionActivityCache {

    private final Map<String, SessionActivityRecord> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionActivityCache(Clock clock) {
        this.clock = clock;
    }

    public void touch(SessionEvent event) {
        if (event.getSessionId() == null) {
            return;
        }
        Instant now = clock.instant();
        sessions.put(event.getSessionId(), SessionActivityRecord.builder()
                .sessionId(event.getSessionId())
                .userId(event.getUserId())
                .agentId(event.getAgentId())
                .teamId(event.getTeamId())
                .startTime(event.getTimestamp() != null ? event.getTimestamp() : now)
                .messageCount(event.getMessageCount())
                .lastActivity(now)
                .build());
    }

    public Optional<SessionActivityRecord> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Removes entries whose last activity is before {@code cutoff}.
     *
     * @return number of evicted sessions
     */
    public int evictOlderThan(Instant cutoff) {
        int evicted = 0;
        for (Map.Entry<String, SessionActivityRecord> entry : sessions.entrySet()) {
            // conditional remove keeps an entry refreshed after the check
            if (entry.getValue().getLastActivity().isBefore(cutoff)
                    && sessions.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    public int activeSessions() {
        return sessions.size();
    }

    public long activeUsers() {
        return sessions.values().stream()
                .map(SessionActivityRecord::getUserId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }
}
