package com.partassist.provider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.partassist.session.Turn;

public class PromptComposer {
    private final String systemPrompt;

    public PromptComposer(String systemPrompt) {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            throw new IllegalArgumentException("System prompt must not be blank");
        }
        this.systemPrompt = systemPrompt.strip();
    }

    public String systemInstruction(ConversationContext context) {
        return context.topic()
                .map(topic -> systemPrompt + "\nThe conversation so far is about: " + topic + ".")
                .orElse(systemPrompt);
    }

    /**
     * Chat-style message list: system instruction, prior turns, then the current question.
     */
    public List<Map<String, String>> messages(String query, ConversationContext context) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", systemInstruction(context)));
        for (Turn turn : context.recentTurns()) {
            messages.add(message(turn.role().wireName(), turn.content().contextText()));
        }
        messages.add(message("user", query));
        return messages;
    }

    /**
     * Single-string prompt for plain text-generation endpoints.
     */
    public String plainPrompt(String query, ConversationContext context) {
        StringBuilder builder = new StringBuilder();
        builder.append("System instruction:\n")
                .append(systemInstruction(context))
                .append("\n\nConversation history:\n");
        if (context.recentTurns().isEmpty()) {
            builder.append("(none)\n");
        } else {
            for (Turn turn : context.recentTurns()) {
                builder.append(turn.role().wireName())
                        .append(": ")
                        .append(turn.content().contextText())
                        .append("\n");
            }
        }
        builder.append("\nCurrent user request:\n")
                .append(query)
                .append("\nassistant:");
        return builder.toString();
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
