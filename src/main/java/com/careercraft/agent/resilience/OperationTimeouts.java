package com.careercraft.agent.resilience;

import com.careercraft.agent.config.AgentProperties;
import com.careercraft.agent.exception.OperationTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Separate time budgets for model calls and tool executions.
 *
 * The work runs on the engine executor while the node thread waits; when the
 * budget runs out the caller gets an {@link OperationTimeoutException}. There is
 * no mid-tool cancellation: a late tool may still finish in the background, its
 * result is simply ignored.
 */
@Component
@Slf4j
public class OperationTimeouts {

    private final TimeLimiter modelLimiter;
    private final TimeLimiter toolLimiter;
    private final Executor executor;

    public OperationTimeouts(AgentProperties properties,
                             @Qualifier("engineTaskExecutor") Executor executor) {
        this.modelLimiter = limiter("model-invoke", properties.getTimeouts().getModelInvoke());
        this.toolLimiter = limiter("tool-execution", properties.getTimeouts().getToolExecution());
        this.executor = executor;
    }

    public <T> T model(Callable<T> task) throws Exception {
        return run(modelLimiter, "model invocation", task);
    }

    public <T> T tool(String toolName, Callable<T> task) throws Exception {
        return run(toolLimiter, toolName + " tool", task);
    }

    private <T> T run(TimeLimiter limiter, String operation, Callable<T> task) throws Exception {
        try {
            return limiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(() -> {
                try {
                    return task.call();
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor));
        } catch (TimeoutException e) {
            Duration budget = limiter.getTimeLimiterConfig().getTimeoutDuration();
            log.warn("{} exceeded its {}s budget", operation, budget.toSeconds());
            throw new OperationTimeoutException(operation, budget);
        }
    }

    private static TimeLimiter limiter(String name, Duration timeout) {
        return TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }
}
