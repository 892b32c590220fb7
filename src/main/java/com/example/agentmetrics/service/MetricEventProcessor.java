package com.example.agentmetrics.service;

import com.example.agentmetrics.classification.ClassificationEngine;
import com.example.agentmetrics.classification.ClassificationResult;
import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.error.ClassificationParseException;
import com.example.agentmetrics.event.ClassificationRequest;
import com.example.agentmetrics.event.ContentEvent;
import com.example.agentmetrics.event.ExecutionEvent;
import com.example.agentmetrics.event.MetricEvent;
import com.example.agentmetrics.event.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns events into persisted rows. The worker loops and the direct ingestion path both
 * go through {@link #process(List)}, so the two paths cannot drift apart.
 */
@Service
public class MetricEventProcessor {

    private static final Logger logger = LoggerFactory.getLogger(MetricEventProcessor.class);

    private final MetricsPersistenceGateway gateway;
    private final ExecutionMetricsDeriver deriver;
    private final TopicExtractor topicExtractor;
    private final SessionActivityCache sessionCache;
    private final ClassificationEngine classificationEngine;
    private final MetricsProperties properties;

    public MetricEventProcessor(MetricsPersistenceGateway gateway,
                                ExecutionMetricsDeriver deriver,
                                TopicExtractor topicExtractor,
                                SessionActivityCache sessionCache,
                                ClassificationEngine classificationEngine,
                                MetricsProperties properties) {
        this.gateway = gateway;
        this.deriver = deriver;
        this.topicExtractor = topicExtractor;
        this.sessionCache = sessionCache;
        this.classificationEngine = classificationEngine;
        this.properties = properties;
    }

    /**
     * Each event is handled on its own; a failing event is logged and dropped without
     * affecting the rest of the batch.
     *
     * @return number of events handled without error
     */
    public int process(List<MetricEvent> batch) {
        int handled = 0;
        for (MetricEvent event : batch) {
            try {
                handle(event);
                handled++;
            } catch (Exception e) {
                logger.error("Dropping {} event for session {}", event.category().getKey(), event.sessionId(), e);
            }
        }
        return handled;
    }

    /**
     * @return true if the event produced rows, false if it was valid but had nothing to store
     */
    boolean handle(MetricEvent event) {
        boolean stored = switch (event.category()) {
            case EXECUTION -> handleExecution((ExecutionEvent) event);
            case CONTENT -> handleContent((ContentEvent) event);
            case SESSION -> handleSession((SessionEvent) event);
            case CLASSIFICATION -> handleClassification((ClassificationRequest) event);
        };
        logger.debug("Handled {} event for session {}, stored={}", event.category().getKey(), event.sessionId(), stored);
        return stored;
    }

    private boolean handleExecution(ExecutionEvent event) {
        // producers other than the ingestion service may enqueue underived events
        gateway.writeExecution(deriver.derive(event));
        return true;
    }

    private boolean handleContent(ContentEvent event) {
        List<String> topics = topicExtractor.extractTopics(event.getMessageContent());
        if (topics.isEmpty()) {
            logger.debug("No topics in content {}, nothing stored", event.getContentId());
            return false;
        }
        gateway.writeContentTopics(event.getSessionId(), event.getAgentId(), topics,
                topicExtractor.extractKeywords(event.getMessageContent()),
                event.getMessageContent(), properties.getDefaultContentConfidence(), event.getTimestamp());
        return true;
    }

    private boolean handleSession(SessionEvent event) {
        gateway.upsertSession(event);
        sessionCache.touch(event);
        return true;
    }

    private boolean handleClassification(ClassificationRequest request) {
        if (gateway.hasAutoGeneratedFeedback(request.getSessionId())) {
            logger.info("Session {} already classified, request {} ignored", request.getSessionId(), request.getRequestId());
            return false;
        }
        ClassificationResult result;
        try {
            result = classificationEngine.classify(request.getSessionId(), request.getMessages());
        } catch (ClassificationParseException e) {
            logger.warn("Unusable classification for session {}, dropped: {}", request.getSessionId(), e.getMessage());
            return false;
        }
        boolean written = gateway.writeClassification(request, result);
        if (written) {
            logger.info("Session {} classified ({}): sentiment={}, category={}", request.getSessionId(),
                    request.getTriggerReason() == null ? "unknown" : request.getTriggerReason().getValue(),
                    result.getSentiment(), result.categoryOrDefault());
        }
        return written;
    }
}
