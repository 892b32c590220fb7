package com.example.agentmetrics.service;

import com.example.agentmetrics.classification.ClassificationResult;
import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.error.PersistenceFailureException;
import com.example.agentmetrics.event.ClassificationRequest;
import com.example.agentmetrics.event.ExecutionEvent;
import com.example.agentmetrics.event.SessionEvent;
import com.example.agentmetrics.model.AgentExecution;
import com.example.agentmetrics.model.ChatSession;
import com.example.agentmetrics.model.ContentTopic;
import com.example.agentmetrics.model.PerformanceMetric;
import com.example.agentmetrics.model.TokenUsage;
import com.example.agentmetrics.model.UserFeedback;
import com.example.agentmetrics.repo.AgentExecutionRepo;
import com.example.agentmetrics.repo.ChatSessionRepo;
import com.example.agentmetrics.repo.ContentTopicRepo;
import com.example.agentmetrics.repo.PerformanceMetricRepo;
import com.example.agentmetrics.repo.TokenUsageRepo;
import com.example.agentmetrics.repo.UserFeedbackRepo;
import com.example.agentmetrics.repo.UserMetricsRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One write routine per record kind. Shared by the queued and the direct path, so it takes
 * already derived events and holds no business rules beyond the aggregate updates.
 */
@Component
public class MetricsPersistenceGateway {

    private static final Logger logger = LoggerFactory.getLogger(MetricsPersistenceGateway.class);

    static final String UNKNOWN_MODEL = "unknown";
    static final String ANONYMOUS_USER = "anonymous";

    private final TokenUsageRepo tokenUsageRepo;
    private final AgentExecutionRepo agentExecutionRepo;
    private final PerformanceMetricRepo performanceMetricRepo;
    private final ContentTopicRepo contentTopicRepo;
    private final UserMetricsRepo userMetricsRepo;
    private final UserFeedbackRepo userFeedbackRepo;
    private final ChatSessionRepo chatSessionRepo;
    private final MetricsProperties properties;
    private final Clock clock;

    public MetricsPersistenceGateway(TokenUsageRepo tokenUsageRepo,
                                     AgentExecutionRepo agentExecutionRepo,
                                     PerformanceMetricRepo performanceMetricRepo,
                                     ContentTopicRepo contentTopicRepo,
                                     UserMetricsRepo userMetricsRepo,
                                     UserFeedbackRepo userFeedbackRepo,
                                     ChatSessionRepo chatSessionRepo,
                                     MetricsProperties properties,
                                     Clock clock) {
        this.tokenUsageRepo = tokenUsageRepo;
        this.agentExecutionRepo = agentExecutionRepo;
        this.performanceMetricRepo = performanceMetricRepo;
        this.contentTopicRepo = contentTopicRepo;
        this.userMetricsRepo = userMetricsRepo;
        this.userFeedbackRepo = userFeedbackRepo;
        this.chatSessionRepo = chatSessionRepo;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Token usage row, raw execution row and the (agent, day) performance upsert.
     * The last two need an agent and are skipped without one.
     */
    @Transactional
    public void writeExecution(ExecutionEvent event) {
        Instant createdAt = timestampOf(event.getTimestamp());
        int inputTokens = event.getInputTokens() == null ? 0 : event.getInputTokens();
        int outputTokens = event.getOutputTokens() == null ? 0 : event.getOutputTokens();
        try {
            tokenUsageRepo.save(TokenUsage.builder()
                    .agentId(event.getAgentId())
                    .sessionId(event.getSessionId())
                    .modelUsed(event.getModel() == null ? UNKNOWN_MODEL : event.getModel())
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .costEstimate(event.getCostEstimate() == null ? 0.0 : event.getCostEstimate())
                    .operationType(event.getOperationType())
                    .createdAt(createdAt)
                    .build());

            if (event.getAgentId() == null) {
                logger.debug("Execution without agent id, performance aggregate skipped");
                return;
            }

            agentExecutionRepo.save(AgentExecution.builder()
                    .agentId(event.getAgentId())
                    .inputText(truncate(event.getInputText(), AgentExecution.MAX_INPUT_CHARS))
                    .outputText(truncate(event.getOutputText(), AgentExecution.MAX_OUTPUT_CHARS))
                    .toolsUsed(event.getToolsUsed() == null ? "" : String.join(",", event.getToolsUsed()))
                    .executionTimeMs(event.getExecutionTimeMs())
                    .tokensUsed(inputTokens + outputTokens)
                    .success(event.isSuccess())
                    .createdAt(createdAt)
                    .build());

            upsertPerformance(event, LocalDate.ofInstant(createdAt, clock.getZone()), inputTokens + outputTokens);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to persist execution metrics for agent " + event.getAgentId(), e);
        }
    }

    private void upsertPerformance(ExecutionEvent event, LocalDate metricDate, int tokens) {
        PerformanceMetric row = performanceMetricRepo.findByAgentIdAndMetricDate(event.getAgentId(), metricDate)
                .orElseGet(() -> PerformanceMetric.empty(event.getAgentId(), metricDate));

        int total = row.getTotalInteractions() + 1;
        int successful = row.getSuccessfulInteractions() + (event.isSuccess() ? 1 : 0);
        row.setTotalInteractions(total);
        row.setSuccessfulInteractions(successful);
        row.setTokensConsumed(row.getTokensConsumed() + tokens);
        row.setAvgResponseTimeMs(properties.getResponseTimeAveraging()
                .combine(row.getAvgResponseTimeMs(), event.getExecutionTimeMs(), total));
        row.setSuccessRate((double) successful / total);
        performanceMetricRepo.save(row);
    }

    @Transactional
    public void writeContentTopics(String sessionId, Long agentId, List<String> topics, List<String> keywords,
                                   String content, double confidence, Instant createdAt) {
        try {
            contentTopicRepo.save(ContentTopic.builder()
                    .sessionId(sessionId)
                    .agentId(agentId)
                    .extractedTopics(topics)
                    .topicKeywords(keywords)
                    .messageContent(truncate(content, ContentTopic.MAX_CONTENT_CHARS))
                    .confidenceScore(confidence)
                    .createdAt(timestampOf(createdAt))
                    .build());
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to persist content topics for session " + sessionId, e);
        }
    }

    /**
     * Conflict key (user, session); message count and duration are added to the stored values.
     */
    @Transactional
    public void upsertSession(SessionEvent event) {
        try {
            userMetricsRepo.upsertSession(
                    event.getUserId() == null ? ANONYMOUS_USER : event.getUserId(),
                    event.getSessionId(),
                    event.getAgentId(),
                    event.getTeamId(),
                    event.getMessageCount(),
                    event.getDurationSeconds(),
                    timestampOf(event.getTimestamp()));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to upsert session metrics for " + event.getSessionId(), e);
        }
    }

    /**
     * Auto-generated feedback row, plus a topic row when the engine returned topics. The check and
     * the insert run under a per-session lock, so two workers cannot both write for one session.
     *
     * @return false when an auto-generated row already exists for the session
     */
    @Transactional
    public boolean writeClassification(ClassificationRequest request, ClassificationResult result) {
        try {
            userFeedbackRepo.lockSessionFeedback(request.getSessionId());
            if (userFeedbackRepo.existsBySessionIdAndAutoGeneratedTrue(request.getSessionId())) {
                return false;
            }
            Instant now = clock.instant();
            userFeedbackRepo.save(UserFeedback.builder()
                    .sessionId(request.getSessionId())
                    .userId(request.getUserId())
                    .agentId(request.getAgentId())
                    .teamId(request.getTeamId())
                    .rating(result.ratingOrDefault())
                    .issueCategory(result.categoryOrDefault())
                    .feedbackComment(result.summaryOrDefault())
                    .sentiment(result.getSentiment())
                    .autoGenerated(true)
                    .createdAt(now)
                    .build());

            if (!result.topicsOrEmpty().isEmpty()) {
                contentTopicRepo.save(ContentTopic.builder()
                        .sessionId(request.getSessionId())
                        .agentId(request.getAgentId())
                        .extractedTopics(result.topicsOrEmpty())
                        .topicKeywords(result.keywordsOrEmpty())
                        .messageContent(truncate("Classificação: " + result.summaryOrDefault(), ContentTopic.MAX_CONTENT_CHARS))
                        .confidenceScore(properties.getClassificationConfidence())
                        .createdAt(now)
                        .build());
            }
            return true;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to persist classification for session " + request.getSessionId(), e);
        }
    }

    @Transactional(readOnly = true)
    public boolean hasAutoGeneratedFeedback(String sessionId) {
        try {
            return userFeedbackRepo.existsBySessionIdAndAutoGeneratedTrue(sessionId);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to check feedback for session " + sessionId, e);
        }
    }

    @Transactional(readOnly = true)
    public List<ChatSession> findIdleSessions(Instant cutoff, int maxCandidates) {
        try {
            return chatSessionRepo.findIdleUnclassified(cutoff, maxCandidates);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to query idle sessions", e);
        }
    }

    private Instant timestampOf(Instant eventTime) {
        return eventTime != null ? eventTime : clock.instant();
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return null;
        }
        return text.length() > max ? text.substring(0, max) : text;
    }
}
