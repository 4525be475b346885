package com.careercraft.agent.agent;

import com.careercraft.agent.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message list for one model call: the node's own instructions,
 * then the conversation without any earlier system messages.
 */
@Component
public class MessagePreparer {

    public List<Message> prepare(String instructions, List<Message> history) {
        List<Message> prompt = new ArrayList<>(history.size() + 1);
        prompt.add(Message.system(instructions));
        for (Message message : history) {
            if (message.getRole() != Message.Role.system) {
                prompt.add(message);
            }
        }
        return prompt;
    }
}
