package com.example.agentmetrics.service;

import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.event.TranscriptMessage;
import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.store.ConversationHistoryReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationCloseServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-10T11:00:00Z");

    @Mock
    private ConversationHistoryReader historyReader;
    @Mock
    private MetricsIngestionService ingestionService;
    @Mock
    private MetricsPersistenceGateway gateway;

    private ConversationCloseService closeService;

    @BeforeEach
    void setUp() {
        closeService = new ConversationCloseService(historyReader, ingestionService, gateway, new MetricsProperties());
    }

    @Test
    void testCloseSession_TwoMessagesDoNotQualifyForInactivity() {
        // Given
        when(historyReader.readHistory("s-1", 20)).thenReturn(history(2));

        // When
        CloseOutcome outcome = closeService.closeSession("s-1", TriggerReason.INACTIVITY_TIMEOUT, null, null);

        // Then
        assertEquals(CloseOutcome.Status.INSUFFICIENT_MESSAGES, outcome.status());
        verifyNoInteractions(ingestionService);
    }

    @Test
    void testCloseSession_ThreeMessagesTriggerClassification() {
        // Given
        List<TranscriptMessage> history = history(3);
        when(historyReader.readHistory("s-1", 20)).thenReturn(history);
        when(ingestionService.requestClassification("s-1", history, 3, TriggerReason.INACTIVITY_TIMEOUT,
                ConversationCloseService.TIMEOUT_USER, 3L, 9L)).thenReturn(true);

        // When
        CloseOutcome outcome = closeService.closeSession("s-1", TriggerReason.INACTIVITY_TIMEOUT, 9L, 3L);

        // Then
        assertTrue(outcome.requested());
        assertEquals(3, outcome.messageCount());
    }

    @Test
    void testCloseSession_ManualCloseNeedsOneMessageAndUsesMetadata() {
        // Given
        List<TranscriptMessage> history = List.of(TranscriptMessage.builder()
                .sender("user")
                .content("Preciso de ajuda com o pneu")
                .timestamp(T0)
                .metadata(Map.of("user_id", "u-77", "agent_id", 12, "team_id", "4"))
                .build());
        when(historyReader.readHistory("s-1", 20)).thenReturn(history);
        when(ingestionService.requestClassification(anyString(), anyList(), anyInt(), any(), any(), any(), any()))
                .thenReturn(true);

        // When
        CloseOutcome outcome = closeService.closeSession("s-1", TriggerReason.MANUAL_CLOSE, null, null);

        // Then
        assertTrue(outcome.requested());
        verify(ingestionService).requestClassification("s-1", history, 1, TriggerReason.MANUAL_CLOSE, "u-77", 12L, 4L);
    }

    @Test
    void testCloseSession_AlreadyClassified() {
        // Given
        when(gateway.hasAutoGeneratedFeedback("s-1")).thenReturn(true);

        // When
        CloseOutcome outcome = closeService.closeSession("s-1", TriggerReason.AUTO_CLOSE, null, null);

        // Then
        assertEquals(CloseOutcome.Status.ALREADY_CLASSIFIED, outcome.status());
        verifyNoInteractions(historyReader, ingestionService);
    }

    @Test
    void testCloseSession_NoHistory() {
        // Given
        when(historyReader.readHistory("missing", 20)).thenReturn(List.of());

        // When
        CloseOutcome outcome = closeService.closeSession("missing", TriggerReason.MANUAL_CLOSE, null, null);

        // Then
        assertEquals(CloseOutcome.Status.NO_MESSAGES, outcome.status());
    }

    @Test
    void testCloseSession_ReaderFailureReportedAsFailed() {
        // Given
        when(historyReader.readHistory(anyString(), anyInt())).thenThrow(new IllegalStateException("mongo down"));

        // When
        CloseOutcome outcome = closeService.closeSession("s-1", TriggerReason.AUTO_CLOSE, null, null);

        // Then
        assertEquals(CloseOutcome.Status.FAILED, outcome.status());
    }

    private static List<TranscriptMessage> history(int size) {
        return IntStream.range(0, size)
                .mapToObj(i -> TranscriptMessage.builder()
                        .sender(i % 2 == 0 ? "user" : "assistant")
                        .content("mensagem " + i)
                        .timestamp(T0.plusSeconds(i * 30L))
                        .build())
                .toList();
    }
}
