package com.example.agentmetrics.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Immutable
@Table(name = "chat_messages")
public class ChatMessage {
    @Id
    private Long id;
    // references chat_sessions.id, not the public session id
    @Column(name = "session_id")
    private Long chatSessionId;
    @Column(name = "message_type")
    private String messageType;
    @Column(name = "content", columnDefinition = "text")
    private String content;
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "message_metadata", columnDefinition = "jsonb")
    private Map<String, Object> messageMetadata;
    @Column(name = "created_at")
    private Instant createdAt;
}
