package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "performance_metrics",
        uniqueConstraints = @UniqueConstraint(name = "uq_performance_agent_date", columnNames = {"agent_id", "metric_date"}))
public class PerformanceMetric {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "agent_id", nullable = false)
    private Long agentId;
    @Column(name = "metric_date", nullable = false)
    private LocalDate metricDate;
    @Column(name = "total_interactions")
    private int totalInteractions;
    @Column(name = "successful_interactions")
    private int successfulInteractions;
    @Column(name = "avg_response_time_ms")
    private double avgResponseTimeMs;
    @Column(name = "tokens_consumed")
    private long tokensConsumed;
    @Column(name = "success_rate")
    private double successRate;

    public static PerformanceMetric empty(Long agentId, LocalDate metricDate) {
        return PerformanceMetric.builder()
                .agentId(agentId)
                .metricDate(metricDate)
                .build();
    }
}
