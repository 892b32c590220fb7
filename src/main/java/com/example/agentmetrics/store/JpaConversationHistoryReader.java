package com.example.agentmetrics.store;

import com.example.agentmetrics.event.TranscriptMessage;
import com.example.agentmetrics.model.ChatMessage;
import com.example.agentmetrics.model.ChatSession;
import com.example.agentmetrics.repo.ChatMessageRepo;
import com.example.agentmetrics.repo.ChatSessionRepo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "app.metrics.history-source", havingValue = "relational", matchIfMissing = true)
public class JpaConversationHistoryReader implements ConversationHistoryReader {

    private final ChatSessionRepo chatSessionRepo;
    private final ChatMessageRepo chatMessageRepo;

    public JpaConversationHistoryReader(ChatSessionRepo chatSessionRepo, ChatMessageRepo chatMessageRepo) {
        this.chatSessionRepo = chatSessionRepo;
        this.chatMessageRepo = chatMessageRepo;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TranscriptMessage> readHistory(String sessionId, int limit) {
        Optional<ChatSession> session = chatSessionRepo.findBySessionId(sessionId);
        if (session.isEmpty()) {
            return List.of();
        }
        List<ChatMessage> messages = chatMessageRepo.findByChatSessionIdOrderByCreatedAtAsc(
                session.get().getId(), PageRequest.of(0, limit));
        return messages.stream()
                .map(m -> TranscriptMessage.builder()
                        .sender(m.getMessageType())
                        .content(m.getContent() == null ? "" : m.getContent())
                        .timestamp(m.getCreatedAt())
                        .metadata(m.getMessageMetadata() == null ? Map.of() : m.getMessageMetadata())
                        .build())
                .collect(Collectors.toList());
    }
}
