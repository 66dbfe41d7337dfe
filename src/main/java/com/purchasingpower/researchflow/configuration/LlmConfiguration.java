package com.purchasingpower.researchflow.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.researchflow.client.LangChainModelClient;
import com.purchasingpower.researchflow.client.ModelClient;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model for the research agent: a local Ollama model through LangChain4j.
 */
@Slf4j
@Configuration
public class LlmConfiguration {

    @Value("${app.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${app.ollama.chat-model:qwen2.5:7b}")
    private String ollamaChatModel;

    @Value("${app.ollama.timeout-seconds:120}")
    private int ollamaTimeoutSeconds;

    @Value("${app.ollama.max-retries:3}")
    private int ollamaMaxRetries;

    @Value("${app.ollama.temperature:0.2}")
    private double temperature;

    @Bean
    public ChatLanguageModel researchChatModel() {
        log.info("🔧 Initializing research chat model (Ollama)");
        log.info("   - URL: {}", ollamaBaseUrl);
        log.info("   - Model: {}", ollamaChatModel);

        return OllamaChatModel.builder()
                .baseUrl(ollamaBaseUrl)
                .modelName(ollamaChatModel)
                .timeout(Duration.ofSeconds(ollamaTimeoutSeconds))
                .temperature(temperature)
                .maxRetries(ollamaMaxRetries)
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Bean
    public ModelClient modelClient(ChatLanguageModel researchChatModel, ObjectMapper objectMapper) {
        return new LangChainModelClient(researchChatModel, objectMapper);
    }
}
