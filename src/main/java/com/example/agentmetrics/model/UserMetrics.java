package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "user_metrics",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_metrics_user_session", columnNames = {"user_id", "session_id"}))
public class UserMetrics {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "user_id", nullable = false)
    private String userId;
    @Column(name = "session_id", nullable = false)
    private String sessionId;
    @Column(name = "agent_id")
    private Long agentId;
    @Column(name = "team_id")
    private Long teamId;
    @Column(name = "total_messages")
    private int totalMessages;
    @Column(name = "session_duration_seconds")
    private long sessionDurationSeconds;
    @Column(name = "created_at")
    private Instant createdAt;
    @Column(name = "updated_at")
    private Instant updatedAt;
}
