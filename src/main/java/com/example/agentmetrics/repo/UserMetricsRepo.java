package com.example.agentmetrics.repo;

import com.example.agentmetrics.model.UserMetrics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface UserMetricsRepo extends JpaRepository<UserMetrics, Long> {

    @Modifying
    @Query(value = """
            INSERT INTO user_metrics (
                user_id, session_id, agent_id, team_id, total_messages,
                session_duration_seconds, created_at, updated_at
            ) VALUES (
                :userId, :sessionId, :agentId, :teamId, :messages,
                :duration, :timestamp, :timestamp
            ) ON CONFLICT (user_id, session_id)
            DO UPDATE SET
                total_messages = user_metrics.total_messages + :messages,
                session_duration_seconds = user_metrics.session_duration_seconds + :duration,
                updated_at = :timestamp
            """, nativeQuery = true)
    int upsertSession(@Param("userId") String userId,
                      @Param("sessionId") String sessionId,
                      @Param("agentId") Long agentId,
                      @Param("teamId") Long teamId,
                      @Param("messages") int messages,
                      @Param("duration") long duration,
                      @Param("timestamp") Instant timestamp);
}
