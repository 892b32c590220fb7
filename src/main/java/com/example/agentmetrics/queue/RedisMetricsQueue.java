package com.example.agentmetrics.queue;

import com.example.agentmetrics.config.MetricsProperties;
import com.example.agentmetrics.error.BrokerUnavailableException;
import com.example.agentmetrics.error.EnqueueFailureException;
import com.example.agentmetrics.event.EventCategory;
import com.example.agentmetrics.event.MetricEvent;
import com.example.agentmetrics.event.QueueMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Redis lists used as queues: producers LPUSH, workers BRPOP, so each list is FIFO.
 */
@Component
public class RedisMetricsQueue implements MetricsQueue {

    private static final Logger logger = LoggerFactory.getLogger(RedisMetricsQueue.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final MetricsProperties properties;
    private final Clock clock;
    private final AtomicBoolean available = new AtomicBoolean(false);

    public RedisMetricsQueue(StringRedisTemplate redis, ObjectMapper objectMapper,
                             MetricsProperties properties, Clock clock) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean connect() {
        try {
            String pong = redis.execute(RedisConnection::ping, true);
            if (!"PONG".equalsIgnoreCase(pong)) {
                throw new BrokerUnavailableException("Unexpected ping reply: " + pong, null);
            }
            available.set(true);
            logger.info("Metrics broker connected");
        } catch (Exception e) {
            available.set(false);
            logger.error("Metrics broker unavailable, running in degraded mode", e);
        }
        return available.get();
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public void push(MetricEvent event) {
        EventCategory category = event.category();
        QueueMessage message = QueueMessage.builder()
                .category(category)
                .enqueuedAt(clock.instant())
                .event(event)
                .build();
        try {
            redis.opsForList().leftPush(properties.queueKey(category), objectMapper.writeValueAsString(message));
        } catch (Exception e) {
            throw new EnqueueFailureException(category, "Failed to enqueue " + category.getKey() + " event", e);
        }
    }

    @Override
    public List<MetricEvent> popBatch(EventCategory category, int maxItems, Duration timeout,
                                      BooleanSupplier keepPopping) {
        String key = properties.queueKey(category);
        List<MetricEvent> batch = new ArrayList<>();
        while (batch.size() < maxItems && keepPopping.getAsBoolean()) {
            String raw = redis.opsForList().rightPop(key, timeout);
            if (raw == null) {
                break;
            }
            try {
                QueueMessage message = objectMapper.readValue(raw, QueueMessage.class);
                batch.add(message.getEvent());
            } catch (JsonProcessingException e) {
                logger.error("Dropping unreadable {} queue item: {}", category.getKey(), e.getOriginalMessage());
            }
        }
        return batch;
    }

    @Override
    public long depth(EventCategory category) {
        Long size = redis.opsForList().size(properties.queueKey(category));
        return size == null ? 0L : size;
    }
}
