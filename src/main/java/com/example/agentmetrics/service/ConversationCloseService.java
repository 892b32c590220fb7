package com.example.agentmetrics.service;

import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.event.TranscriptMessage;
import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.store.ConversationHistoryReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Closes a conversation for analytics: reads its transcript and asks for a classification.
 */
@Service
public class ConversationCloseService {

    private static final Logger logger = LoggerFactory.getLogger(ConversationCloseService.class);

    static final String TIMEOUT_USER = "auto_timeout";

    private final ConversationHistoryReader historyReader;
    private final MetricsIngestionService ingestionService;
    private final MetricsPersistenceGateway gateway;
    private final MetricsProperties properties;

    public ConversationCloseService(ConversationHistoryReader historyReader,
                                    MetricsIngestionService ingestionService,
                                    MetricsPersistenceGateway gateway,
                                    MetricsProperties properties) {
        this.historyReader = historyReader;
        this.ingestionService = ingestionService;
        this.gateway = gateway;
        this.properties = properties;
    }

    /**
     * Automatic triggers need the configured minimum of messages, a manual close needs one.
     * Ids missing from the arguments are taken from the transcript metadata.
     */
    public CloseOutcome closeSession(String sessionId, TriggerReason trigger, Long teamId, Long agentId) {
        try {
            if (gateway.hasAutoGeneratedFeedback(sessionId)) {
                return new CloseOutcome(CloseOutcome.Status.ALREADY_CLASSIFIED, sessionId, 0);
            }
            List<TranscriptMessage> history = historyReader.readHistory(sessionId, properties.getHistoryLimit());
            if (history.isEmpty()) {
                return new CloseOutcome(CloseOutcome.Status.NO_MESSAGES, sessionId, 0);
            }
            int required = trigger.isAutomatic() ? properties.getMinMessagesForClassification() : 1;
            if (history.size() < required) {
                logger.debug("Session {} has {} messages, {} required for {}",
                        sessionId, history.size(), required, trigger.getValue());
                return new CloseOutcome(CloseOutcome.Status.INSUFFICIENT_MESSAGES, sessionId, history.size());
            }

            String userId = trigger == TriggerReason.INACTIVITY_TIMEOUT
                    ? TIMEOUT_USER
                    : metadataString(history, "user_id");
            Long agent = agentId != null ? agentId : metadataLong(history, "agent_id");
            Long team = teamId != null ? teamId : metadataLong(history, "team_id");

            boolean accepted = ingestionService.requestClassification(
                    sessionId, history, history.size(), trigger, userId, agent, team);
            return new CloseOutcome(accepted ? CloseOutcome.Status.REQUESTED : CloseOutcome.Status.FAILED,
                    sessionId, history.size());
        } catch (Exception e) {
            logger.error("Failed to close session {}", sessionId, e);
            return new CloseOutcome(CloseOutcome.Status.FAILED, sessionId, 0);
        }
    }

    private static String metadataString(List<TranscriptMessage> history, String key) {
        for (TranscriptMessage message : history) {
            Map<String, Object> metadata = message.getMetadata();
            if (metadata != null && metadata.get(key) != null) {
                return String.valueOf(metadata.get(key));
            }
        }
        return null;
    }

    private static Long metadataLong(List<TranscriptMessage> history, String key) {
        String value = metadataString(history, key);
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non numeric {} in message metadata: {}", key, value);
            return null;
        }
    }
}
