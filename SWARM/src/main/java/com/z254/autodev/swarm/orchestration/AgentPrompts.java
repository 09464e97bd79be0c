package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.AgentResult;
import com.z254.autodev.swarm.llm.ChatMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the messages sent on behalf of an agent.
 */
public final class AgentPrompts {

    private AgentPrompts() {
    }

    public static String systemPrompt(String agentType) {
        return "You are an AI agent specialized in " + agentType
                + ". Execute the following task with expertise and attention to detail.";
    }

    /**
     * System message naming the specialization, then the task; prior outputs are appended as context in step order.
     */
    public static List<ChatMessage> messages(String agentType, String description, List<AgentResult> priorResults) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemPrompt(agentType)));
        StringBuilder user = new StringBuilder(description);
        if (priorResults != null && !priorResults.isEmpty()) {
            user.append("\n\nContext from previous agents:");
            for (AgentResult prior : priorResults) {
                user.append("\n\n[").append(prior.getAgentType()).append("]: ").append(prior.getOutput());
            }
        }
        messages.add(ChatMessage.user(user.toString()));
        return messages;
    }
}
