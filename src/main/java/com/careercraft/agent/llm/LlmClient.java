package com.careercraft.agent.llm;

import com.careercraft.agent.model.LlmResponse;
import com.careercraft.agent.model.Message;
import com.careercraft.agent.tool.ToolDefinition;

import java.util.List;

public interface LlmClient {

    /**
     * Send the conversation and the tool schemas bound for this call to the model.
     *
     * @param messages    system prompt followed by the conversation so far
     * @param tools       tool definitions the model may invoke; empty for none
     * @param temperature sampling temperature for this call
     * @return raw content plus any structured tool calls, neither validated yet
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools, double temperature);
}
