package com.example.agentmetrics.classification;

import com.example.agentmetrics.error.ClassificationParseException;
import com.example.agentmetrics.event.TranscriptMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Classifies conversations with a low temperature chat model answering in JSON.
 */
public class ChatClientClassificationEngine implements ClassificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ChatClientClassificationEngine.class);

    static final int MAX_TRANSCRIPT_MESSAGES = 10;
    static final int MAX_MESSAGE_CHARS = 200;

    static final String SYSTEM_PROMPT = """
            You are an expert in analysing technical support conversations.

            Analyse the conversation and extract:
            1. Main topics mentioned
            2. User sentiment (positivo/negativo/neutro)
            3. Estimated satisfaction level (1-5)
            4. Problem category (técnico, comercial, suporte, ...)
            5. Solution complexity (baixa, média, alta)
            6. Relevant keywords

            Answer ONLY with JSON:
            {
                "topics": ["topic1", "topic2"],
                "sentiment": "positivo|negativo|neutro",
                "satisfaction": 1-5,
                "category": "category",
                "complexity": "baixa|média|alta",
                "keywords": ["word1", "word2"],
                "summary": "one line summary"
            }
            """;

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    public ChatClientClassificationEngine(ChatClient chatClient, ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ClassificationResult classify(String sessionId, List<TranscriptMessage> transcript) {
        String prompt = "Analyse this support conversation:\n\n"
                + formatTranscript(transcript)
                + "\n\nProvide the analysis as JSON as instructed.";
        String answer = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(prompt)
                .call()
                .content();
        logger.debug("Classifier answered for session {}", sessionId);
        return parse(answer);
    }

    static String formatTranscript(List<TranscriptMessage> transcript) {
        int from = Math.max(0, transcript.size() - MAX_TRANSCRIPT_MESSAGES);
        return transcript.subList(from, transcript.size()).stream()
                .map(m -> (m.getSender() == null ? "user" : m.getSender()) + ": " + truncate(m.getContent()))
                .collect(Collectors.joining("\n"));
    }

    ClassificationResult parse(String answer) {
        if (answer == null || answer.isBlank()) {
            throw new ClassificationParseException("Empty classifier answer");
        }
        try {
            ClassificationResult result = objectMapper.reader()
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .forType(ClassificationResult.class)
                    .readValue(cleanJson(answer));
            if (result == null) {
                throw new ClassificationParseException("Classifier answered null");
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new ClassificationParseException("Classifier answer is not valid JSON", e);
        }
    }

    /**
     * Strips a surrounding markdown code fence, with or without a language tag.
     */
    static String cleanJson(String answer) {
        String s = answer.trim();
        int fenced = s.indexOf("```json");
        if (fenced >= 0) {
            s = s.substring(fenced + 7);
        } else if (s.contains("```")) {
            s = s.substring(s.indexOf("```") + 3);
        } else {
            return s;
        }
        int end = s.indexOf("```");
        return (end >= 0 ? s.substring(0, end) : s).trim();
    }

    private static String truncate(String content) {
        if (content == null) return "";
        return content.length() > MAX_MESSAGE_CHARS ? content.substring(0, MAX_MESSAGE_CHARS) : content;
    }
}
