package com.example.agentmetrics.classification;

import com.example.agentmetrics.error.ClassificationParseException;
import com.example.agentmetrics.event.TranscriptMessage;

import java.util.List;

/**
 * Structured analysis of a conversation transcript.
 */
public interface ClassificationEngine {

    /**
     * @param transcript messages ordered oldest first
     * @throws ClassificationParseException when the engine output is not a usable result
     */
    ClassificationResult classify(String sessionId, List<TranscriptMessage> transcript);
}
