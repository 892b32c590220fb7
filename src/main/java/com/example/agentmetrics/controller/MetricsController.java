package com.example.agentmetrics.controller;

import com.example.agentmetrics.service.MetricsStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

    private final MetricsStatusService statusService;

    public MetricsController(MetricsStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/realtime")
    public Mono<Map<String, Object>> realtime() {
        return Mono.fromCallable(statusService::snapshot).subscribeOn(Schedulers.boundedElastic());
    }
}
