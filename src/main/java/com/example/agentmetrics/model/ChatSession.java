package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Chat session row owned by the chat subsystem. Read only here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Immutable
@Table(name = "chat_sessions")
public class ChatSession {
    @Id
    private Long id;
    @Column(name = "session_id", unique = true)
    private String sessionId;
    @Column(name = "team_id")
    private Long teamId;
    @Column(name = "agent_id")
    private Long agentId;
    @Column(name = "created_at")
    private Instant createdAt;
    @Column(name = "last_activity")
    private Instant lastActivity;
}
