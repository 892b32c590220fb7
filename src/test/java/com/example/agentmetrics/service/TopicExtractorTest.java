package com.example.agentmetrics.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicExtractorTest {

    private final TopicExtractor extractor = new TopicExtractor();

    @Test
    void testExtractTopics_BrakeProblem() {
        // When
        List<String> topics = extractor.extractTopics("Problema no freio da CH570");

        // Then
        assertTrue(topics.contains("freios"));
        assertTrue(topics.contains("problema"));
    }

    @Test
    void testExtractTopics_AccentedVocabulary() {
        // When
        List<String> topics = extractor.extractTopics("Preciso agendar a MANUTENÇÃO preventiva do sistema hidráulico");

        // Then
        assertEquals(List.of("hidráulico", "manutenção"), topics);
    }

    @Test
    void testExtractTopics_NoMatch() {
        assertTrue(extractor.extractTopics("Bom dia, tudo certo?").isEmpty());
        assertTrue(extractor.extractTopics(null).isEmpty());
    }

    @Test
    void testExtractKeywords_StopWordsAndShortWordsRemoved() {
        // When
        List<String> keywords = extractor.extractKeywords("Problema no freio da CH570 com o freio traseiro");

        // Then
        assertEquals("freio", keywords.get(0));
        assertTrue(keywords.contains("problema"));
        assertTrue(keywords.contains("ch570"));
        assertFalse(keywords.contains("com"));
        assertFalse(keywords.contains("no"));
    }

    @Test
    void testExtractKeywords_LimitedToTopTen() {
        // When
        List<String> keywords = extractor.extractKeywords(
                "alfa beta gama delta epsilon zeta eta1 theta iota kappa lambda mu12");

        // Then
        assertEquals(TopicExtractor.MAX_KEYWORDS, keywords.size());
        assertEquals("alfa", keywords.get(0));
    }
}
