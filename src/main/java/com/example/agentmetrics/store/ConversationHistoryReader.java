package com.example.agentmetrics.store;

import com.example.agentmetrics.event.TranscriptMessage;

import java.util.List;

/**
 * Source of chat transcripts, owned by the chat subsystem.
 */
public interface ConversationHistoryReader {

    /**
     * Oldest-first messages of the session, at most {@code limit}. Empty when the session is unknown.
     */
    List<TranscriptMessage> readHistory(String sessionId, int limit);
}
