package com.example.agentmetrics.repo;

import com.example.agentmetrics.model.UserFeedback;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserFeedbackRepo extends JpaRepository<UserFeedback, Long> {

    boolean existsBySessionIdAndAutoGeneratedTrue(String sessionId);

    /**
     * Transaction-scoped advisory lock on the session id. Concurrent classifications of the same
     * session serialize here until the holder commits.
     */
    @Query(value = "SELECT 1 FROM (SELECT pg_advisory_xact_lock(hashtext(:sessionId))) l", nativeQuery = true)
    Integer lockSessionFeedback(@Param("sessionId") String sessionId);
}
