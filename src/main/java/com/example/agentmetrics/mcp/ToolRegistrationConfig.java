package com.example.agentmetrics.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    @Bean
    public ToolCallbackProvider metricsToolCallbacks(MetricsTools metricsTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(metricsTools)
                .build();
    }
}
