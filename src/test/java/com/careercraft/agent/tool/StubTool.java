package com.careercraft.agent.tool;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configurable tool for executor and registry tests. Records every call.
 */
class StubTool implements CareerTool {

    interface Behaviour {
        String run(String userId, Map<String, Object> args) throws Exception;
    }

    private final String name;
    private final Map<String, Object> schema;
    private final Behaviour behaviour;
    final List<Map<String, Object>> calls = new ArrayList<>();
    final List<String> userIds = new ArrayList<>();

    StubTool(String name, Map<String, Object> schema, Behaviour behaviour) {
        this.name = name;
        this.schema = schema;
        this.behaviour = behaviour;
    }

    static StubTool returning(String name, String result) {
        return new StubTool(name, Map.of("type", "object", "properties", Map.of()), (u, a) -> result);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return "Stub " + name;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return schema;
    }

    @Override
    public String execute(String userId, Map<String, Object> arguments) throws Exception {
        userIds.add(userId);
        calls.add(arguments);
        return behaviour.run(userId, arguments);
    }
}
