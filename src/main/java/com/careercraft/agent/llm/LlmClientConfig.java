package com.careercraft.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw model client for the provider selected by {@code llm.provider}.
 * The engine never sees this bean directly: {@code ResilientLlmClient} wraps it.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;

    // Gemini
    @Value("${gemini.api-key:}") private String geminiKey;
    @Value("${gemini.base-url}") private String geminiBaseUrl;
    @Value("${gemini.model}")    private String geminiModel;
    @Value("${gemini.max-tokens}") private int geminiMaxTokens;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(ObjectMapper objectMapper,
                                     @Qualifier("llmRestClientBuilder") RestClient.Builder builder) {

        return switch (provider.toLowerCase()) {
            case "openai" -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new GenericLlmClient(props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens),
                        objectMapper, "openai", builder.clone());
            }
            case "gemini" -> {
                logKey("GEMINI", geminiKey, "GEMINI_API_KEY");
                yield new GenericLlmClient(props(geminiKey, geminiBaseUrl, geminiModel, geminiMaxTokens),
                        objectMapper, "gemini", builder.clone());
            }
            default -> { // groq
                logKey("GROQ", groqKey, "GROQ_API_KEY");
                yield new GenericLlmClient(props(groqKey, groqBaseUrl, groqModel, groqMaxTokens),
                        objectMapper, "groq", builder.clone());
            }
        };
    }

    private static LlmProviderProperties props(String key, String baseUrl, String model, int maxTokens) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key);
        p.setBaseUrl(baseUrl);
        p.setModel(model);
        p.setMaxTokens(maxTokens);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openAiModel;
            case "gemini" -> geminiModel;
            default -> groqModel;
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
