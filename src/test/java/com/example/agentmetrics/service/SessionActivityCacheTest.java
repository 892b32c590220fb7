package com.example.agentmetrics.service;

import com.example.agentmetrics.event.SessionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionActivityCacheTest {

    private static final Instant T0 = Instant.parse("2025-03-10T08:00:00Z");

    @Mock
    private Clock clock;

    private SessionActivityCache cache;

    @BeforeEach
    void setUp() {
        cache = new SessionActivityCache(clock);
    }

    @Test
    void testTouch_LastWriteWins() {
        // Given
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(60));

        // When
        cache.touch(session("s-1", "alice", 1));
        cache.touch(session("s-1", "alice", 5));

        // Then
        SessionActivityRecord record = cache.get("s-1").orElseThrow();
        assertEquals(5, record.getMessageCount());
        assertEquals(T0.plusSeconds(60), record.getLastActivity());
        assertEquals(1, cache.activeSessions());
    }

    @Test
    void testEvictOlderThan_RemovesOnlyStaleEntries() {
        // Given
        when(clock.instant()).thenReturn(T0, T0.plus(Duration.ofHours(23)));
        cache.touch(session("old", "alice", 1));
        cache.touch(session("fresh", "bob", 1));

        // When
        int evicted = cache.evictOlderThan(T0.plus(Duration.ofHours(1)));

        // Then
        assertEquals(1, evicted);
        assertTrue(cache.get("old").isEmpty());
        assertTrue(cache.get("fresh").isPresent());
    }

    @Test
    void testActiveUsers_DistinctNonNull() {
        // Given
        when(clock.instant()).thenReturn(T0);
        cache.touch(session("s-1", "alice", 1));
        cache.touch(session("s-2", "alice", 1));
        cache.touch(session("s-3", null, 1));

        // Then
        assertEquals(3, cache.activeSessions());
        assertEquals(1, cache.activeUsers());
    }

    private static SessionEvent session(String sessionId, String userId, int messages) {
        return SessionEvent.builder()
                .sessionId(sessionId)
                .userId(userId)
                .messageCount(messages)
                .timestamp(T0)
                .build();
    }
}
