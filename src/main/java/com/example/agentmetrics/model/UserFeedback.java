package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "user_feedback")
public class UserFeedback {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "session_id")
    private String sessionId;
    @Column(name = "user_id")
    private String userId;
    @Column(name = "agent_id")
    private Long agentId;
    @Column(name = "team_id")
    private Long teamId;
    @Column(name = "rating")
    private int rating;
    @Column(name = "issue_category")
    private String issueCategory;
    @Column(name = "feedback_comment")
    private String feedbackComment;
    @Column(name = "sentiment")
    private String sentiment;
    @Column(name = "auto_generated")
    private boolean autoGenerated;
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
