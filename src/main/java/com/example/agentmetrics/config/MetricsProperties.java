package com.example.agentmetrics.config;

import com.example.agentmetrics.event.EventCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.metrics")
public class MetricsProperties {

    private String queuePrefix = "metrics";
    private int batchSize = 10;
    private Duration pollTimeout = Duration.ofSeconds(1);
    private Duration classificationPollTimeout = Duration.ofSeconds(10);
    private Duration failureBackoff = Duration.ofSeconds(1);
    private Duration shutdownGrace = Duration.ofSeconds(15);

    private Duration cacheTtl = Duration.ofHours(24);
    private Duration cleanupInterval = Duration.ofHours(1);

    private Duration idleThreshold = Duration.ofMinutes(15);
    private Duration idleScanInterval = Duration.ofMinutes(5);
    private int maxIdleCandidates = 10;
    private int minMessagesForClassification = 3;
    private int historyLimit = 20;
    private String historySource = "relational";

    private ResponseTimeAveraging responseTimeAveraging = ResponseTimeAveraging.HALVING;
    private double defaultContentConfidence = 0.8;
    private double classificationConfidence = 0.9;

    /**
     * Classification is less throughput sensitive and waits longer per poll.
     */
    public Duration pollTimeoutFor(EventCategory category) {
        return category == EventCategory.CLASSIFICATION ? classificationPollTimeout : pollTimeout;
    }

    public String queueKey(EventCategory category) {
        return queuePrefix + ":" + category.getKey();
    }

    public enum ResponseTimeAveraging {
        /** {@code (previous + new) / 2}, the historical behaviour of the dashboards. */
        HALVING {
            @Override
            public double combine(double previousAverage, double newValue, int interactionCount) {
                return (previousAverage + newValue) / 2;
            }
        },
        /** True running mean over all interactions of the day. */
        WEIGHTED {
            @Override
            public double combine(double previousAverage, double newValue, int interactionCount) {
                if (interactionCount <= 1) {
                    return newValue;
                }
                return previousAverage + (newValue - previousAverage) / interactionCount;
            }
        };

        /**
         * @param interactionCount interactions including the new one
         */
        public abstract double combine(double previousAverage, double newValue, int interactionCount);
    }
}
