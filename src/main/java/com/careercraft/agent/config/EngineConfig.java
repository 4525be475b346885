package com.careercraft.agent.config;

import com.careercraft.agent.agent.AgentNodeFactory;
import com.careercraft.agent.agent.AgentRoleConfig;
import com.careercraft.agent.agent.SupervisorNode;
import com.careercraft.agent.graph.GraphNode;
import com.careercraft.agent.graph.GraphRouter;
import com.careercraft.agent.graph.NodeFunction;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the turn graph: the supervisor plus one node per configured agent role.
 * Startup fails if a role names a tool nobody registered or an agent has no role.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GraphRouter graphRouter(SupervisorNode supervisor,
                                   AgentNodeFactory nodeFactory,
                                   List<AgentRoleConfig> roles,
                                   AgentProperties properties) {
        Map<GraphNode, NodeFunction> nodes = new EnumMap<>(GraphNode.class);
        nodes.put(GraphNode.SUPERVISOR, supervisor);
        for (AgentRoleConfig role : roles) {
            if (nodes.put(role.getRole(), nodeFactory.create(role)) != null) {
                throw new IllegalStateException("Duplicate agent role: " + role.agentType());
            }
        }
        for (GraphNode agent : GraphNode.agents()) {
            if (!nodes.containsKey(agent)) {
                throw new IllegalStateException("No role configured for agent: " + agent.wireName());
            }
        }
        return new GraphRouter(nodes, properties.getGraph().getMaxSteps());
    }
}
