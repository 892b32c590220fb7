package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "content_topics")
public class ContentTopic {
    public static final int MAX_CONTENT_CHARS = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "session_id")
    private String sessionId;
    @Column(name = "agent_id")
    private Long agentId;
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extracted_topics", columnDefinition = "jsonb")
    private List<String> extractedTopics;
    @Column(name = "message_content", length = MAX_CONTENT_CHARS)
    private String messageContent;
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "topic_keywords", columnDefinition = "jsonb")
    private List<String> topicKeywords;
    @Column(name = "confidence_score")
    private double confidenceScore;
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
