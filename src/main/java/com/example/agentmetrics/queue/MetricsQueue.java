package com.example.agentmetrics.queue;

import com.example.agentmetrics.event.EventCategory;
import com.example.agentmetrics.event.MetricEvent;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * FIFO list per event category on the external broker.
 */
public interface MetricsQueue {

    /**
     * Checks the broker once. A broker that is unreachable here stays unavailable for the
     * lifetime of the process.
     */
    boolean connect();

    boolean isAvailable();

    void push(MetricEvent event);

    /**
     * Pops up to {@code maxItems} events, oldest first, waiting at most {@code timeout} for each.
     * Returns an empty list when nothing arrived.
     */
    default List<MetricEvent> popBatch(EventCategory category, int maxItems, Duration timeout) {
        return popBatch(category, maxItems, timeout, () -> true);
    }

    /**
     * Same as {@link #popBatch(EventCategory, int, Duration)}, but stops taking items as soon as
     * {@code keepPopping} turns false. Items already popped are always returned.
     */
    List<MetricEvent> popBatch(EventCategory category, int maxItems, Duration timeout, BooleanSupplier keepPopping);

    long depth(EventCategory category);
}
