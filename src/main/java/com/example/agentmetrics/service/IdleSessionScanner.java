package com.example.agentmetrics.service;

import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.model.ChatSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodically classifies conversations that went quiet without being closed.
 */
@Component
public class IdleSessionScanner {

    private static final Logger logger = LoggerFactory.getLogger(IdleSessionScanner.class);

    private final MetricsPersistenceGateway gateway;
    private final ConversationCloseService closeService;
    private final MetricsProperties properties;
    private final Clock clock;
    private volatile Instant lastRunAt;

    public IdleSessionScanner(MetricsPersistenceGateway gateway, ConversationCloseService closeService,
                              MetricsProperties properties, Clock clock) {
        this.gateway = gateway;
        this.closeService = closeService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.metrics.idle-scan-interval:PT5M}",
            initialDelayString = "${app.metrics.idle-scan-interval:PT5M}")
    public void run() {
        try {
            scan();
        } catch (Exception e) {
            logger.error("Idle session scan failed", e);
        }
    }

    /**
     * @return number of classification requests issued
     */
    public int scan() {
        Instant now = clock.instant();
        List<ChatSession> candidates = gateway.findIdleSessions(
                now.minus(properties.getIdleThreshold()), properties.getMaxIdleCandidates());
        int requested = 0;
        for (ChatSession session : candidates) {
            try {
                // the candidate query and this check both read the store, never the cache
                if (gateway.hasAutoGeneratedFeedback(session.getSessionId())) {
                    continue;
                }
                CloseOutcome outcome = closeService.closeSession(session.getSessionId(),
                        TriggerReason.INACTIVITY_TIMEOUT, session.getTeamId(), session.getAgentId());
                if (outcome.requested()) {
                    requested++;
                }
            } catch (Exception e) {
                logger.error("Idle close failed for session {}", session.getSessionId(), e);
            }
        }
        lastRunAt = now;
        if (!candidates.isEmpty()) {
            logger.info("Idle scan: {} candidates, {} classification requests", candidates.size(), requested);
        }
        return requested;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }
}
