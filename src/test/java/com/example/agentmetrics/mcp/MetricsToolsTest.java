package com.example.agentmetrics.mcp;

import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.service.CloseOutcome;
import com.example.agentmetrics.service.ConversationCloseService;
import com.example.agentmetrics.service.MetricsIngestionService;
import com.example.agentmetrics.service.MetricsStatusService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsToolsTest {

    @Mock
    private MetricsStatusService statusService;
    @Mock
    private MetricsIngestionService ingestionService;
    @Mock
    private ConversationCloseService closeService;
    @InjectMocks
    private MetricsTools tools;

    @Test
    void testMetricsStatus_ReturnsPipelineSnapshot() {
        // Given
        Map<String, Object> snapshot = Map.of("brokerConnected", true, "activeSessions", 2);
        when(statusService.snapshot()).thenReturn(snapshot);

        // When
        Map<String, Object> result = tools.metrics_status();

        // Then
        assertSame(snapshot, result);
    }

    @Test
    void testCollectSession_DefaultsMessageCountAndDuration() {
        // When
        Map<String, Object> result = tools.metrics_collect_session("s-1", "u-1", 3L, null, null, null);

        // Then
        verify(ingestionService).collectSession("s-1", "u-1", 3L, null, 1, 0L, null);
        assertEquals("s-1", result.get("sessionId"));
        assertEquals(true, result.get("accepted"));
    }

    @Test
    void testCollectSession_ExplicitCountsPassedThrough() {
        // When
        tools.metrics_collect_session("s-1", "u-1", null, 7L, 12, 340L);

        // Then
        verify(ingestionService).collectSession(eq("s-1"), eq("u-1"), isNull(), eq(7L), eq(12), eq(340L), isNull());
    }

    @Test
    void testRequestSessionClose_ManualTriggerAndOutcomeMapped() {
        // Given
        when(closeService.closeSession("s-1", TriggerReason.MANUAL_CLOSE, 9L, 4L))
                .thenReturn(new CloseOutcome(CloseOutcome.Status.REQUESTED, "s-1", 6));

        // When
        Map<String, Object> result = tools.metrics_request_session_close("s-1", 9L, 4L);

        // Then
        assertEquals("requested", result.get("status"));
        assertEquals(true, result.get("classificationQueued"));
        assertEquals(6, result.get("messageCount"));
    }

    @Test
    void testRequestSessionClose_AlreadyClassifiedNotQueued() {
        // Given
        when(closeService.closeSession(anyString(), any(), any(), any()))
                .thenReturn(new CloseOutcome(CloseOutcome.Status.ALREADY_CLASSIFIED, "s-1", 0));

        // When
        Map<String, Object> result = tools.metrics_request_session_close("s-1", null, null);

        // Then
        assertEquals("already_classified", result.get("status"));
        assertEquals(false, result.get("classificationQueued"));
    }
}
