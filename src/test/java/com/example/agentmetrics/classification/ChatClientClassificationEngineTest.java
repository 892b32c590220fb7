package com.example.agentmetrics.classification;

import com.example.agentmetrics.error.ClassificationParseException;
import com.example.agentmetrics.event.TranscriptMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatClientClassificationEngineTest {

    @Mock(answer = org.mockito.Answers.RETURNS_DEEP_STUBS)
    private ChatClient chatClient;

    private ChatClientClassificationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ChatClientClassificationEngine(chatClient, new ObjectMapper());
    }

    @Test
    void testParse_FencedJson() {
        // Given
        String answer = """
                Here is the analysis:
                ```json
                {"topics": ["freios"], "sentiment": "negativo", "satisfaction": 2,
                 "category": "técnico", "complexity": "média", "keywords": ["pastilha"],
                 "summary": "Freio com ruído", "confidence": 0.7}
                ```
                """;

        // When
        ClassificationResult result = engine.parse(answer);

        // Then
        assertEquals(List.of("freios"), result.getTopics());
        assertEquals("negativo", result.getSentiment());
        assertEquals(2, result.ratingOrDefault());
        assertEquals("técnico", result.categoryOrDefault());
        assertEquals("Freio com ruído", result.getSummary());
    }

    @Test
    void testParse_PlainJsonWithMissingFieldsUsesDefaults() {
        // When
        ClassificationResult result = engine.parse("{\"sentiment\": \"neutro\"}");

        // Then
        assertEquals(ClassificationResult.NEUTRAL_SATISFACTION, result.ratingOrDefault());
        assertEquals(ClassificationResult.DEFAULT_CATEGORY, result.categoryOrDefault());
        assertEquals(ClassificationResult.DEFAULT_SUMMARY, result.summaryOrDefault());
        assertTrue(result.topicsOrEmpty().isEmpty());
    }

    @Test
    void testParse_MalformedAnswerRejected() {
        assertThrows(ClassificationParseException.class, () -> engine.parse("I could not analyse this."));
        assertThrows(ClassificationParseException.class, () -> engine.parse("```json\n{\"topics\": [\n```"));
        assertThrows(ClassificationParseException.class, () -> engine.parse("   "));
    }

    @Test
    void testCleanJson_FenceWithoutLanguageTag() {
        assertEquals("{\"a\": 1}", ChatClientClassificationEngine.cleanJson("```\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", ChatClientClassificationEngine.cleanJson("  {\"a\": 1}  "));
    }

    @Test
    void testFormatTranscript_LastTenMessagesTruncated() {
        // Given
        List<TranscriptMessage> transcript = IntStream.range(0, 15)
                .mapToObj(i -> TranscriptMessage.builder()
                        .sender(i % 2 == 0 ? "user" : "assistant")
                        .content(i + ":" + "x".repeat(300))
                        .build())
                .toList();

        // When
        String formatted = ChatClientClassificationEngine.formatTranscript(transcript);

        // Then
        String[] lines = formatted.split("\n");
        assertEquals(10, lines.length);
        assertTrue(lines[0].startsWith("assistant: 5:"));
        assertEquals("assistant: ".length() + 200, lines[0].length());
    }

    @Test
    void testClassify_ParsesModelAnswer() {
        // Given
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenReturn("{\"sentiment\": \"positivo\", \"satisfaction\": 5}");
        List<TranscriptMessage> transcript = List.of(
                TranscriptMessage.builder().sender("user").content("O pneu furou").build(),
                TranscriptMessage.builder().sender("assistant").content("Use o estepe").build());

        // When
        ClassificationResult result = engine.classify("s-1", transcript);

        // Then
        assertEquals("positivo", result.getSentiment());
        assertEquals(5, result.ratingOrDefault());
    }
}
