package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Truncated raw execution row, kept for response time drill-downs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "agent_executions")
public class AgentExecution {
    public static final int MAX_INPUT_CHARS = 1000;
    public static final int MAX_OUTPUT_CHARS = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "agent_id")
    private Long agentId;
    @Column(name = "input_text", length = MAX_INPUT_CHARS)
    private String inputText;
    @Column(name = "output_text", length = MAX_OUTPUT_CHARS)
    private String outputText;
    @Column(name = "tools_used")
    private String toolsUsed;
    @Column(name = "execution_time_ms")
    private long executionTimeMs;
    @Column(name = "tokens_used")
    private int tokensUsed;
    @Column(name = "success")
    private boolean success;
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
