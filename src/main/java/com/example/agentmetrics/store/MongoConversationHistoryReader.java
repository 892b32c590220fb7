package com.example.agentmetrics.store;

import com.example.agentmetrics.event.TranscriptMessage;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Reads transcripts from the {@code chats} collection, where each chat document keeps its
 * messages in the {@code mensagens} array.
 */
@Component
@ConditionalOnProperty(name = "app.metrics.history-source", havingValue = "mongo")
public class MongoConversationHistoryReader implements ConversationHistoryReader {

    static final String CHATS = "chats";

    private final MongoTemplate mongo;

    public MongoConversationHistoryReader(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public List<TranscriptMessage> readHistory(String sessionId, int limit) {
        Document chat = mongo.findOne(Query.query(Criteria.where("chat_id").is(sessionId)), Document.class, CHATS);
        if (chat == null) {
            return List.of();
        }
        List<Document> messages = chat.getList("mensagens", Document.class, List.of());
        List<TranscriptMessage> out = new ArrayList<>();
        for (Document m : messages) {
            if (out.size() >= limit) break;
            Map<String, Object> metadata = new HashMap<>();
            putIfPresent(metadata, "agent_id", chat.get("agent_id"));
            putIfPresent(metadata, "team_id", chat.get("team_id"));
            putIfPresent(metadata, "user_id", chat.get("created_by"));
            putIfPresent(metadata, "user_assistant_id", m.get("user_assistant_id"));
            out.add(TranscriptMessage.builder()
                    .sender(m.getString("message_type"))
                    .content(Objects.toString(m.get("mensagem"), ""))
                    .timestamp(toInstant(m.get("created_at")))
                    .metadata(metadata)
                    .build());
        }
        return out;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) target.put(key, value);
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }
}
