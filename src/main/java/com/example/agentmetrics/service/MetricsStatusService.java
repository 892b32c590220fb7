package com.example.agentmetrics.service;

import com.example.agentmetrics.event.EventCategory;
import com.example.agentmetrics.queue.MetricsQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational read of the pipeline: broker connectivity, queue depths, loop liveness and
 * the activity cache.
 */
@Service
public class MetricsStatusService {

    private static final Logger logger = LoggerFactory.getLogger(MetricsStatusService.class);

    private final MetricsQueue queue;
    private final MetricsCollector collector;
    private final MetricsWorkerPool workerPool;
    private final SessionActivityCache sessionCache;
    private final SessionCacheCleanupWorker cleanupWorker;
    private final IdleSessionScanner idleScanner;
    private final Clock clock;

    public MetricsStatusService(MetricsQueue queue, MetricsCollector collector, MetricsWorkerPool workerPool,
                                SessionActivityCache sessionCache, SessionCacheCleanupWorker cleanupWorker,
                                IdleSessionScanner idleScanner, Clock clock) {
        this.queue = queue;
        this.collector = collector;
        this.workerPool = workerPool;
        this.sessionCache = sessionCache;
        this.cleanupWorker = cleanupWorker;
        this.idleScanner = idleScanner;
        this.clock = clock;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("brokerConnected", queue.isAvailable());
        status.put("degradedMode", collector.isDegraded());
        status.put("queueDepths", queueDepths());

        Map<String, Object> workers = new LinkedHashMap<>();
        workerPool.stats().forEach((category, stats) -> workers.put(category.getKey(), stats));
        status.put("workers", workers);

        status.put("activeSessions", sessionCache.activeSessions());
        status.put("activeUsers", sessionCache.activeUsers());
        status.put("lastCleanup", cleanupWorker.getLastRunAt());
        status.put("lastIdleScan", idleScanner.getLastRunAt());
        status.put("timestamp", clock.instant());
        return status;
    }

    private Map<String, Object> queueDepths() {
        Map<String, Object> depths = new LinkedHashMap<>();
        if (!queue.isAvailable()) {
            return depths;
        }
        for (EventCategory category : EventCategory.values()) {
            try {
                depths.put(category.getKey(), queue.depth(category));
            } catch (Exception e) {
                logger.warn("Could not read depth of {} queue: {}", category.getKey(), e.getMessage());
                depths.put(category.getKey(), "unavailable");
            }
        }
        return depths;
    }
}
