package com.example.agentmetrics.repo;

import com.example.agentmetrics.model.AgentExecution;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AgentExecutionRepo extends JpaRepository<AgentExecution, Long> {}
