package com.example.agentmetrics.service;

import com.example.agentmetrics.error.EnqueueFailureException;
import com.example.agentmetrics.event.ClassificationRequest;
import com.example.agentmetrics.event.ContentEvent;
import com.example.agentmetrics.event.ExecutionEvent;
import com.example.agentmetrics.event.MetricEvent;
import com.example.agentmetrics.event.SessionEvent;
import com.example.agentmetrics.event.TranscriptMessage;
import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.queue.MetricsQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fire-and-forget entry points for platform telemetry. Events are queued when the broker is
 * up and written directly otherwise. None of these methods throws.
 */
@Service
public class MetricsIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(MetricsIngestionService.class);

    private final MetricsQueue queue;
    private final MetricEventProcessor processor;
    private final ExecutionMetricsDeriver deriver;
    private final SessionActivityCache sessionCache;
    private final MetricsPersistenceGateway gateway;
    private final Clock clock;

    public MetricsIngestionService(MetricsQueue queue,
                                   MetricEventProcessor processor,
                                   ExecutionMetricsDeriver deriver,
                                   SessionActivityCache sessionCache,
                                   MetricsPersistenceGateway gateway,
                                   Clock clock) {
        this.queue = queue;
        this.processor = processor;
        this.deriver = deriver;
        this.sessionCache = sessionCache;
        this.gateway = gateway;
        this.clock = clock;
    }

    public void collectExecution(ExecutionEvent event) {
        try {
            ExecutionEvent derived = deriver.derive(event.getTimestamp() == null
                    ? event.toBuilder().timestamp(clock.instant()).build()
                    : event);
            submit(derived);
        } catch (Exception e) {
            logger.error("Failed to collect execution metrics for agent {}", event.getAgentId(), e);
        }
    }

    public void collectExecution(Long agentId, String agentName, String model, long executionTimeMs,
                                 String inputText, String outputText,
                                 Integer inputTokens, Integer outputTokens, Double costEstimate,
                                 List<String> toolsUsed, String sessionId, boolean success,
                                 String operationType, Instant timestamp) {
        collectExecution(ExecutionEvent.builder()
                .agentId(agentId)
                .agentName(agentName)
                .model(model)
                .executionTimeMs(executionTimeMs)
                .inputText(inputText)
                .outputText(outputText)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .costEstimate(costEstimate)
                .toolsUsed(toolsUsed == null ? List.of() : toolsUsed)
                .sessionId(sessionId)
                .success(success)
                .operationType(operationType == null ? "chat" : operationType)
                .timestamp(timestamp)
                .build());
    }

    public void collectContent(ContentEvent event) {
        try {
            submit(event.getTimestamp() == null
                    ? ContentEvent.builder()
                        .contentId(event.getContentId())
                        .contentType(event.getContentType())
                        .messageContent(event.getMessageContent())
                        .agentId(event.getAgentId())
                        .agentName(event.getAgentName())
                        .sessionId(event.getSessionId())
                        .timestamp(clock.instant())
                        .build()
                    : event);
        } catch (Exception e) {
            logger.error("Failed to collect content metrics for session {}", event.getSessionId(), e);
        }
    }

    public void collectContent(String contentId, String contentType, String messageContent,
                               Long agentId, String agentName, String sessionId) {
        collectContent(ContentEvent.builder()
                .contentId(contentId)
                .contentType(contentType)
                .messageContent(messageContent)
                .agentId(agentId)
                .agentName(agentName)
                .sessionId(sessionId)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Also refreshes the activity cache immediately, so the real-time view does not wait for
     * the session worker.
     */
    public void collectSession(SessionEvent event) {
        try {
            sessionCache.touch(event);
            submit(event);
        } catch (Exception e) {
            logger.error("Failed to collect session metrics for {}", event.getSessionId(), e);
        }
    }

    public void collectSession(String sessionId, String userId, Long agentId, Long teamId,
                               int messageCount, long durationSeconds, Instant timestamp) {
        collectSession(SessionEvent.builder()
                .sessionId(sessionId)
                .userId(userId)
                .agentId(agentId)
                .teamId(teamId)
                .messageCount(messageCount)
                .durationSeconds(durationSeconds)
                .timestamp(timestamp == null ? clock.instant() : timestamp)
                .build());
    }

    /**
     * @return false when the request was not accepted, either because the session already has
     * an auto-generated classification or because of an internal failure
     */
    public boolean requestClassification(String sessionId, List<TranscriptMessage> messages, int totalMessages,
                                         TriggerReason triggerReason, String userId, Long agentId, Long teamId) {
        try {
            if (gateway.hasAutoGeneratedFeedback(sessionId)) {
                logger.info("Session {} already has an automatic classification, request skipped", sessionId);
                return false;
            }
            ClassificationRequest request = ClassificationRequest.builder()
                    .requestId(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .messages(messages == null ? List.of() : List.copyOf(messages))
                    .totalMessages(totalMessages)
                    .triggerReason(triggerReason)
                    .userId(userId)
                    .agentId(agentId)
                    .teamId(teamId)
                    .timestamp(clock.instant())
                    .build();
            submit(request);
            logger.info("Classification requested for session {} ({} messages, {})",
                    sessionId, totalMessages, triggerReason == null ? "unknown" : triggerReason.getValue());
            return true;
        } catch (Exception e) {
            logger.error("Failed to request classification for session {}", sessionId, e);
            return false;
        }
    }

    private void submit(MetricEvent event) {
        if (!queue.isAvailable()) {
            logger.debug("Broker unavailable, writing {} event directly", event.category().getKey());
            processor.process(List.of(event));
            return;
        }
        try {
            queue.push(event);
        } catch (EnqueueFailureException e) {
            logger.warn("Enqueue of {} event failed, writing directly: {}", e.getCategory().getKey(), e.getMessage());
            processor.process(List.of(event));
        }
    }
}
