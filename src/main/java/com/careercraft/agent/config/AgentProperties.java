package com.careercraft.agent.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the orchestration engine.
 * Bound from application.yml under the "agent" prefix and injected into
 * every node that needs a ceiling, a timeout or a temperature.
 *
 * Defaults match the dev profile; prod tightens the loop limits.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Validated
@Data
public class AgentProperties {

    @Valid
    private Model model = new Model();

    @Valid
    private Timeouts timeouts = new Timeouts();

    @Valid
    private LoopLimits loopLimits = new LoopLimits();

    @Valid
    private Graph graph = new Graph();

    @Valid
    private Duplicates duplicates = new Duplicates();

    @Valid
    private Results results = new Results();

    @Valid
    private History history = new History();

    @Data
    public static class Model {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double supervisorTemperature = 0.0;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double agentTemperature = 0.2;
    }

    @Data
    public static class Timeouts {
        @NotNull
        private Duration modelInvoke = Duration.ofSeconds(30);

        @NotNull
        private Duration toolExecution = Duration.ofSeconds(15);

        @AssertTrue(message = "timeouts must be positive")
        public boolean isPositive() {
            return modelInvoke != null && !modelInvoke.isNegative() && !modelInvoke.isZero()
                    && toolExecution != null && !toolExecution.isNegative() && !toolExecution.isZero();
        }
    }

    @Data
    public static class LoopLimits {
        @Positive
        private int maxAgentSwitches = 10;

        @Positive
        private int maxToolCallsPerAgent = 5;

        @Positive
        private int maxClarificationRounds = 3;
    }

    @Data
    public static class Graph {
        /** Hard cap on node executions in one turn */
        @Positive
        private int maxSteps = 25;
    }

    @Data
    public static class Duplicates {

        public enum Scope {
            /** Recent completed actions are carried into the next turn */
            CONVERSATION,
            /** Completed actions are discarded at turn end */
            TURN
        }

        @NotNull
        private Duration recencyWindow = Duration.ofMinutes(5);

        /** Tools whose primary argument is a long free-text payload, compared by hash */
        private List<String> contentTools = new ArrayList<>(
                List.of("parse_and_store_resume", "parse_and_store_job_posting"));

        @NotBlank
        private String contentArgument = "content";

        @NotNull
        private Scope scope = Scope.CONVERSATION;
    }

    @Data
    public static class Results {
        @Positive
        private int storedPrefixLength = 500;

        @Positive
        private int previewLength = 200;
    }

    @Data
    public static class History {
        @NotNull
        private Duration ttl = Duration.ofMinutes(60);

        @Positive
        private int maxMessages = 40;
    }
}
