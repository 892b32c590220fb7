package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "token_usage")
public class TokenUsage {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "agent_id")
    private Long agentId;
    @Column(name = "session_id")
    private String sessionId;
    @Column(name = "model_used")
    private String modelUsed;
    @Column(name = "input_tokens")
    private int inputTokens;
    @Column(name = "output_tokens")
    private int outputTokens;
    @Column(name = "cost_estimate")
    private double costEstimate;
    @Column(name = "operation_type")
    private String operationType;
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
