package com.careercraft.agent.agent;

import com.careercraft.agent.graph.GraphNode;
import com.careercraft.agent.tool.ToolDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The two tools bound to the supervisor. They are never executed: the call
 * itself is the routing or clarification decision.
 */
final class SupervisorTools {

    static final String ROUTE = "route_to_agent";
    static final String CLARIFY = "request_clarification";

    static final Map<String, Object> CLARIFY_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "question", Map.of(
                            "type", "string",
                            "description", "One short question that resolves the ambiguity"),
                    "options", Map.of(
                            "type", "array",
                            "items", Map.of("type", "string"),
                            "description", "Concrete choices the user can pick from")
            ),
            "required", List.of("question")
    );

    private SupervisorTools() {
    }

    static List<ToolDefinition> definitions() {
        return List.of(route(), clarify());
    }

    private static ToolDefinition route() {
        List<String> destinations = new ArrayList<>();
        GraphNode.agents().forEach(a -> destinations.add(a.wireName()));
        destinations.add(GraphNode.END.wireName());

        return ToolDefinition.builder()
                .name(ROUTE)
                .description("Select the next agent to act or end the conversation.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "next", Map.of("type", "string", "enum", destinations)),
                        "required", List.of("next")))
                .build();
    }

    private static ToolDefinition clarify() {
        return ToolDefinition.builder()
                .name(CLARIFY)
                .description("Ask the user one clarifying question when the request is ambiguous.")
                .inputSchema(CLARIFY_SCHEMA)
                .build();
    }
}
