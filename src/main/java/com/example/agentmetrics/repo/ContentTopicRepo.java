package com.example.agentmetrics.repo;

import com.example.agentmetrics.model.ContentTopic;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ContentTopicRepo extends JpaRepository<ContentTopic, Long> {}
