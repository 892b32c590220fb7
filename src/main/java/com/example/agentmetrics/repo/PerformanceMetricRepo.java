package com.example.agentmetrics.repo;

import com.example.agentmetrics.model.PerformanceMetric;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;

import java.time.LocalDate;
import java.util.Optional;

public interface PerformanceMetricRepo extends JpaRepository<PerformanceMetric, Long> {

    /**
     * Row for the (agent, day) conflict key, locked for the rest of the transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<PerformanceMetric> findByAgentIdAndMetricDate(Long agentId, LocalDate metricDate);
}
