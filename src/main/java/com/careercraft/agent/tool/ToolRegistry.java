package com.careercraft.agent.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for all {@link CareerTool} implementations.
 *
 * Spring auto-discovers every @Component that implements CareerTool
 * and injects them as a List. We index them by name for O(1) lookup;
 * each agent role then asks for its own subset, bound to the turn's user.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, CareerTool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<CareerTool> toolBeans) {
        toolBeans.forEach(tool -> {
            CareerTool previous = tools.put(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        log.info("Total tools registered: {}", tools.size());
    }

    /**
     * The named tools bound to {@code userId}, in the order given.
     *
     * @throws IllegalArgumentException if a name is not registered
     */
    public List<AgentTool> toolsFor(String userId, Collection<String> names) {
        return names.stream()
                .map(name -> require(name).bindTo(userId))
                .toList();
    }

    public List<ToolDefinition> definitions(Collection<AgentTool> boundTools) {
        return boundTools.stream().map(ToolDefinition::from).toList();
    }

    /** Fails fast when a role refers to a tool nobody registered */
    public void requireAll(Collection<String> names) {
        names.forEach(this::require);
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }

    private CareerTool require(String name) {
        CareerTool tool = tools.get(name);
        if (tool == null) {
            throw new IllegalArgumentException(
                    "Unknown tool '" + name + "'. Registered tools: " + tools.keySet());
        }
        return tool;
    }
}
