package com.example.agentmetrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMetricsApplication.class, args);
    }
}
