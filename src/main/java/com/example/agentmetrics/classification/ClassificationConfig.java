package com.example.agentmetrics.classification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClassificationConfig {

    @Bean
    public ClassificationEngine classificationEngine(ChatClient.Builder builder,
                                                     ObjectMapper objectMapper,
                                                     @Value("${app.metrics.classifier.model:gpt-4o-mini}") String model,
                                                     @Value("${app.metrics.classifier.temperature:0.1}") double temperature) {
        ChatClient chatClient = builder
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(model)
                        .temperature(temperature)
                        .build())
                .build();
        return new ChatClientClassificationEngine(chatClient, objectMapper);
    }
}
