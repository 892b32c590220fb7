package com.example.agentmetrics.repo;

import com.example.agentmetrics.model.TokenUsage;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TokenUsageRepo extends JpaRepository<TokenUsage, Long> {}
