package com.careercraft.agent.resilience;

import com.careercraft.agent.exception.AgentException;
import com.careercraft.agent.exception.LlmInvocationException;
import com.careercraft.agent.llm.LlmClient;
import com.careercraft.agent.model.LlmResponse;
import com.careercraft.agent.model.Message;
import com.careercraft.agent.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the provider client that adds retry + circuit breaker.
 * This is the only place model calls are retried.
 *
 * Retry config (in application.yml):
 * - 2 attempts, 1s backoff between them
 * - Retries on network errors, 429 and 5xx; AgentException is never retried
 *
 * Circuit breaker config:
 * - Opens after 50% failure rate in sliding window of 10 calls
 * - Waits 30s before allowing trial calls (half-open state)
 *
 * Fallbacks rethrow as {@link LlmInvocationException}; the calling node turns
 * that into its own apology. Configuration errors pass through unchanged.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, double temperature) {
        return delegate.chat(messages, tools, temperature);
    }

    /**
     * Retry fallback: all retry attempts exhausted.
     */
    public LlmResponse retryFallback(List<Message> messages,
                                     List<ToolDefinition> tools,
                                     double temperature,
                                     Exception ex) {
        if (ex instanceof AgentException agentException) {
            throw agentException;
        }
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        throw new LlmInvocationException("Model call failed after retries", ex);
    }

    /**
     * Circuit breaker fallback: the circuit is open or the call failed inside it.
     */
    public LlmResponse circuitBreakerFallback(List<Message> messages,
                                              List<ToolDefinition> tools,
                                              double temperature,
                                              Exception ex) {
        if (ex instanceof AgentException agentException) {
            throw agentException;
        }
        log.error("LLM circuit breaker rejected or failed call: {}", ex.getMessage());
        throw new LlmInvocationException("Model service unavailable", ex);
    }
}
