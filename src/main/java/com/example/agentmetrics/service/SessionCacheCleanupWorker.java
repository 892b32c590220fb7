package com.example.agentmetrics.service;

import com.example.agentmetrics.config.MetricsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
public class SessionCacheCleanupWorker {

    private static final Logger logger = LoggerFactory.getLogger(SessionCacheCleanupWorker.class);

    private final SessionActivityCache sessionCache;
    private final MetricsProperties properties;
    private final Clock clock;
    private volatile Instant lastRunAt;

    public SessionCacheCleanupWorker(SessionActivityCache sessionCache, MetricsProperties properties, Clock clock) {
        this.sessionCache = sessionCache;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.metrics.cleanup-interval:PT1H}",
            initialDelayString = "${app.metrics.cleanup-interval:PT1H}")
    public void run() {
        try {
            Instant now = clock.instant();
            int evicted = sessionCache.evictOlderThan(now.minus(properties.getCacheTtl()));
            lastRunAt = now;
            if (evicted > 0) {
                logger.info("Evicted {} inactive sessions from the activity cache", evicted);
            }
        } catch (Exception e) {
            logger.error("Session cache cleanup failed", e);
        }
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }
}
