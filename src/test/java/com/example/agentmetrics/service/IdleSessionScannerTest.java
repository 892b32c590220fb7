package com.example.agentmetrics.service;

import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.model.ChatSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdleSessionScannerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    private MetricsPersistenceGateway gateway;
    @Mock
    private ConversationCloseService closeService;

    private IdleSessionScanner scanner;

    /** sessions with an auto-generated feedback row */
    private final Set<String> classified = new HashSet<>();

    @BeforeEach
    void setUp() {
        scanner = new IdleSessionScanner(gateway, closeService, new MetricsProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testScan_SecondRunIssuesNoNewRequests() {
        // Given
        List<ChatSession> idle = List.of(chat(1L, "s-1"), chat(2L, "s-2"));
        when(gateway.findIdleSessions(NOW.minus(Duration.ofMinutes(15)), 10)).thenReturn(idle);
        when(gateway.hasAutoGeneratedFeedback(anyString())).thenAnswer(inv -> classified.contains(inv.<String>getArgument(0)));
        when(closeService.closeSession(anyString(), eq(TriggerReason.INACTIVITY_TIMEOUT), any(), any()))
                .thenAnswer(inv -> {
                    String sessionId = inv.getArgument(0);
                    classified.add(sessionId);
                    return new CloseOutcome(CloseOutcome.Status.REQUESTED, sessionId, 3);
                });

        // When
        int first = scanner.scan();
        int second = scanner.scan();

        // Then
        assertEquals(2, first);
        assertEquals(0, second);
        verify(closeService, times(1)).closeSession(eq("s-1"), any(), any(), any());
        verify(closeService, times(1)).closeSession(eq("s-2"), any(), any(), any());
        assertEquals(NOW, scanner.getLastRunAt());
    }

    @Test
    void testScan_PassesSessionIdsToClose() {
        // Given
        ChatSession session = chat(1L, "s-1");
        session.setTeamId(9L);
        session.setAgentId(3L);
        when(gateway.findIdleSessions(any(), anyInt())).thenReturn(List.of(session));
        when(gateway.hasAutoGeneratedFeedback("s-1")).thenReturn(false);
        when(closeService.closeSession("s-1", TriggerReason.INACTIVITY_TIMEOUT, 9L, 3L))
                .thenReturn(new CloseOutcome(CloseOutcome.Status.INSUFFICIENT_MESSAGES, "s-1", 2));

        // When
        int requested = scanner.scan();

        // Then
        assertEquals(0, requested);
    }

    @Test
    void testScan_CandidateFailureDoesNotStopScan() {
        // Given
        when(gateway.findIdleSessions(any(), anyInt())).thenReturn(List.of(chat(1L, "s-1"), chat(2L, "s-2")));
        when(gateway.hasAutoGeneratedFeedback("s-1")).thenThrow(new IllegalStateException("db"));
        when(gateway.hasAutoGeneratedFeedback("s-2")).thenReturn(false);
        when(closeService.closeSession(eq("s-2"), any(), any(), any()))
                .thenReturn(new CloseOutcome(CloseOutcome.Status.REQUESTED, "s-2", 4));

        // When
        int requested = scanner.scan();

        // Then
        assertEquals(1, requested);
    }

    @Test
    void testRun_QueryFailureSwallowed() {
        // Given
        when(gateway.findIdleSessions(any(), anyInt())).thenThrow(new IllegalStateException("db"));

        // When / Then
        assertDoesNotThrow(scanner::run);
        verifyNoInteractions(closeService);
    }

    private static ChatSession chat(Long id, String sessionId) {
        return ChatSession.builder()
                .id(id)
                .sessionId(sessionId)
                .lastActivity(NOW.minus(Duration.ofMinutes(30)))
                .build();
    }
}
