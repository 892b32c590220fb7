package com.example.agentmetrics.service;

import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.event.EventCategory;
import com.example.agentmetrics.event.MetricEvent;
import com.example.agentmetrics.queue.MetricsQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One consumer loop per event category, each on its own thread. A failing iteration
 * is logged and followed by a backoff; it never ends the loop.
 */
@Component
public class MetricsWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(MetricsWorkerPool.class);

    private final MetricsQueue queue;
    private final MetricEventProcessor processor;
    private final MetricsProperties properties;
    private final Clock clock;

    private final Map<EventCategory, LoopState> loops = new EnumMap<>(EventCategory.class);
    private volatile boolean running;
    private ExecutorService executor;

    public MetricsWorkerPool(MetricsQueue queue, MetricEventProcessor processor,
                             MetricsProperties properties, Clock clock) {
        this.queue = queue;
        this.processor = processor;
        this.properties = properties;
        this.clock = clock;
        for (EventCategory category : EventCategory.values()) {
            loops.put(category, new LoopState());
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        // non-daemon, so the JVM waits for an in-flight batch on exit
        executor = Executors.newFixedThreadPool(EventCategory.values().length);
        for (EventCategory category : EventCategory.values()) {
            executor.submit(() -> runLoop(category));
        }
        logger.info("Started {} metrics worker loops, batch size {}", loops.size(), properties.getBatchSize());
    }

    /**
     * Stops taking new items and waits for every loop to finish its in-flight batch. Popped
     * events are never abandoned, so there is no hard deadline; a slow batch is only reported.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        long graceMillis = properties.getShutdownGrace().toMillis();
        try {
            while (!executor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Metrics worker loops still finishing their batches after {}", properties.getShutdownGrace());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for metrics worker loops, in-flight batches continue");
            return;
        }
        logger.info("Metrics worker loops stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop(EventCategory category) {
        Thread.currentThread().setName("metrics-worker-" + category.getKey());
        LoopState state = loops.get(category);
        state.running = true;
        try {
            while (running) {
                if (!pollOnce(category) && !backoff()) {
                    logger.warn("Metrics worker loop for {} interrupted, exiting", category.getKey());
                    return;
                }
            }
        } finally {
            state.running = false;
        }
    }

    /**
     * One iteration: pop up to a batch and process it.
     *
     * @return false if the iteration failed
     */
    boolean pollOnce(EventCategory category) {
        LoopState state = loops.get(category);
        try {
            List<MetricEvent> batch = queue.popBatch(category, properties.getBatchSize(),
                    properties.pollTimeoutFor(category), () -> running);
            if (!batch.isEmpty()) {
                int handled = processor.process(batch);
                state.processed.addAndGet(handled);
                logger.debug("Processed {}/{} {} events", handled, batch.size(), category.getKey());
            }
            return true;
        } catch (Exception e) {
            state.failedIterations.incrementAndGet();
            logger.error("Metrics worker iteration failed for {}", category.getKey(), e);
            return false;
        } finally {
            state.lastIterationAt.set(clock.instant());
        }
    }

    /**
     * @return false if the calling loop was interrupted and should exit
     */
    boolean backoff() {
        try {
            Thread.sleep(properties.getFailureBackoff().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public Map<EventCategory, WorkerStats> stats() {
        Map<EventCategory, WorkerStats> snapshot = new EnumMap<>(EventCategory.class);
        loops.forEach((category, state) -> snapshot.put(category, new WorkerStats(
                state.running, state.lastIterationAt.get(), state.processed.get(), state.failedIterations.get())));
        return snapshot;
    }

    private static final class LoopState {
        private volatile boolean running;
        private final AtomicReference<Instant> lastIterationAt = new AtomicReference<>();
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong failedIterations = new AtomicLong();
    }
}
