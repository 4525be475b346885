package com.careercraft.agent.graph;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Every state of the turn state machine. {@link #END} is the terminal sentinel.
 */
public enum GraphNode {

    SUPERVISOR("supervisor"),
    DATA_MANAGER("data_manager"),
    RESUME_GENERATOR("resume_generator"),
    COVER_LETTER_GENERATOR("cover_letter_generator"),
    USER_PROFILE("user_profile"),
    JOB_POSTING_MANAGER("job_posting_manager"),
    END("__end__");

    private final String wireName;

    GraphNode(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in prompts, routing arguments and logs */
    public String wireName() {
        return wireName;
    }

    public boolean isAgent() {
        return this != SUPERVISOR && this != END;
    }

    public static List<GraphNode> agents() {
        return Arrays.stream(values()).filter(GraphNode::isAgent).toList();
    }

    /**
     * Resolves a routing destination. Accepts the wire name, {@code "END"} and
     * {@code "__end__"} case-insensitively; anything else is unknown.
     */
    public static Optional<GraphNode> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim();
        if (normalized.equalsIgnoreCase("END")) {
            return Optional.of(END);
        }
        return Arrays.stream(values())
                .filter(n -> n.wireName.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
