package com.example.agentmetrics.store;

import com.example.agentmetrics.event.TranscriptMessage;
import com.example.agentmetrics.model.ChatMessage;
import com.example.agentmetrics.model.ChatSession;
import com.example.agentmetrics.repo.ChatMessageRepo;
import com.example.agentmetrics.repo.ChatSessionRepo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaConversationHistoryReaderTest {

    private static final Instant T0 = Instant.parse("2025-03-10T11:00:00Z");

    @Mock
    private ChatSessionRepo chatSessionRepo;
    @Mock
    private ChatMessageRepo chatMessageRepo;
    @InjectMocks
    private JpaConversationHistoryReader reader;

    @Test
    void testReadHistory_MapsMessagesInOrder() {
        // Given
        when(chatSessionRepo.findBySessionId("s-1"))
                .thenReturn(Optional.of(ChatSession.builder().id(10L).sessionId("s-1").build()));
        when(chatMessageRepo.findByChatSessionIdOrderByCreatedAtAsc(10L, PageRequest.of(0, 20))).thenReturn(List.of(
                ChatMessage.builder().id(1L).chatSessionId(10L).messageType("user").content("Oi")
                        .messageMetadata(Map.of("user_id", "u-1")).createdAt(T0).build(),
                ChatMessage.builder().id(2L).chatSessionId(10L).messageType("assistant").content(null)
                        .createdAt(T0.plusSeconds(5)).build()));

        // When
        List<TranscriptMessage> history = reader.readHistory("s-1", 20);

        // Then
        assertEquals(2, history.size());
        assertEquals("user", history.get(0).getSender());
        assertEquals("u-1", history.get(0).getMetadata().get("user_id"));
        assertEquals("", history.get(1).getContent());
        assertTrue(history.get(1).getMetadata().isEmpty());
    }

    @Test
    void testReadHistory_UnknownSession() {
        // Given
        when(chatSessionRepo.findBySessionId("missing")).thenReturn(Optional.empty());

        // When / Then
        assertTrue(reader.readHistory("missing", 20).isEmpty());
        verifyNoInteractions(chatMessageRepo);
    }
}
