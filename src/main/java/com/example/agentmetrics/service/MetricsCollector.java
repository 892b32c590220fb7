package com.example.agentmetrics.service;

import com.example.agentmetrics.queue.MetricsQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Process-wide lifecycle of the pipeline. The broker is contacted once at start; if it is
 * unreachable the process stays in degraded mode until restart and every event is
 * written directly by the ingestion service.
 */
@Component
public class MetricsCollector implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MetricsQueue queue;
    private final MetricsWorkerPool workerPool;
    private volatile boolean started;
    private volatile boolean degraded;

    public MetricsCollector(MetricsQueue queue, MetricsWorkerPool workerPool) {
        this.queue = queue;
        this.workerPool = workerPool;
    }

    @Override
    public void start() {
        if (queue.connect()) {
            degraded = false;
            workerPool.start();
            logger.info("Metrics collector started");
        } else {
            degraded = true;
            logger.warn("Metrics collector started in degraded mode, events are written directly");
        }
        started = true;
    }

    @Override
    public void stop() {
        workerPool.stop();
        started = false;
        logger.info("Metrics collector stopped");
    }

    @Override
    public boolean isRunning() {
        return started;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
