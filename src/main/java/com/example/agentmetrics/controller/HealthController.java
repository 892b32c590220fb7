package com.example.agentmetrics.controller;

import com.example.agentmetrics.service.MetricsStatusService;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final MetricsStatusService statusService;
    private final JdbcTemplate jdbcTemplate;

    public HealthController(MetricsStatusService statusService, JdbcTemplate jdbcTemplate) {
        this.statusService = statusService;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Always UP while the process serves requests; a broker outage shows as degraded, not down.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("service", "agent-metrics");

            Map<String, Object> pipeline = statusService.snapshot();
            health.put("redis", Boolean.TRUE.equals(pipeline.get("brokerConnected")) ? "UP" : "DOWN");

            try {
                jdbcTemplate.queryForObject("SELECT 1", Integer.class);
                health.put("database", "UP");
            } catch (Exception e) {
                health.put("database", "DOWN");
                health.put("databaseError", e.getMessage());
            }

            health.put("metrics", pipeline);
            return ResponseEntity.ok(health);
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
