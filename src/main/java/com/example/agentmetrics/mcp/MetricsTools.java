package com.example.agentmetrics.mcp;

import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.service.CloseOutcome;
import com.example.agentmetrics.service.ConversationCloseService;
import com.example.agentmetrics.service.MetricsIngestionService;
import com.example.agentmetrics.service.MetricsStatusService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class MetricsTools {

    private final MetricsStatusService statusService;
    private final MetricsIngestionService ingestionService;
    private final ConversationCloseService closeService;

    public MetricsTools(MetricsStatusService statusService,
                        MetricsIngestionService ingestionService,
                        ConversationCloseService closeService) {
        this.statusService = statusService;
        this.ingestionService = ingestionService;
        this.closeService = closeService;
    }

    @Tool(description = "Get metrics pipeline status: broker connectivity, queue depths, worker liveness and active sessions")
    public Map<String, Object> metrics_status() {
        return statusService.snapshot();
    }

    @Tool(description = "Record chat session activity for a user")
    public Map<String, Object> metrics_collect_session(String sessionId,
                                                       String userId,
                                                       @ToolParam(required = false) Long agentId,
                                                       @ToolParam(required = false) Long teamId,
                                                       @ToolParam(required = false) Integer messageCount,
                                                       @ToolParam(required = false) Long durationSeconds) {
        ingestionService.collectSession(sessionId, userId, agentId, teamId,
                messageCount == null ? 1 : messageCount,
                durationSeconds == null ? 0L : durationSeconds,
                null);
        return Map.of("sessionId", sessionId, "accepted", true);
    }

    @Tool(description = "Close a chat session and request its automatic classification")
    public Map<String, Object> metrics_request_session_close(String sessionId,
                                                             @ToolParam(required = false) Long teamId,
                                                             @ToolParam(required = false) Long agentId) {
        CloseOutcome outcome = closeService.closeSession(sessionId, TriggerReason.MANUAL_CLOSE, teamId, agentId);
        return Map.of(
                "sessionId", sessionId,
                "status", outcome.status().name().toLowerCase(),
                "classificationQueued", outcome.requested(),
                "messageCount", outcome.messageCount()
        );
    }
}
