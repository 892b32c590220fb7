package com.example.agentmetrics.repo;

import com.example.agentmetrics.model.ChatSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ChatSessionRepo extends JpaRepository<ChatSession, Long> {

    Optional<ChatSession> findBySessionId(String sessionId);

    /**
     * Sessions idle since before the cutoff that were never auto-classified, most recent first.
     */
    @Query(value = """
            SELECT cs.* FROM chat_sessions cs
            WHERE cs.last_activity < :cutoff
              AND NOT EXISTS (
                  SELECT 1 FROM user_feedback uf
                  WHERE uf.session_id = cs.session_id
                    AND uf.auto_generated = true
              )
            ORDER BY cs.last_activity DESC
            LIMIT :maxResults
            """, nativeQuery = true)
    List<ChatSession> findIdleUnclassified(@Param("cutoff") Instant cutoff, @Param("maxResults") int maxResults);
}
