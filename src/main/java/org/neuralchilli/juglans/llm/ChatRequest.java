package org.neuralchilli.juglans.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.neuralchilli.juglans.domain.ToolDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * One model turn: the conversation so far and the tools the model may call.
 *
 * @param messages OpenAI-shaped messages ({@code role}, {@code content}, {@code tool_calls}, ...),
 *                 without the system prompt
 * @param stream   deliver content incrementally to the token listener
 */
public record ChatRequest(
        String model,
        String systemPrompt,
        List<JsonNode> messages,
        Double temperature,
        List<ToolDefinition> tools,
        String chatId,
        boolean stream
) {

    public ChatRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    /**
     * Same request with more messages appended, for the next turn of a tool loop
     */
    public ChatRequest withMessages(List<JsonNode> more) {
        List<JsonNode> all = new ArrayList<>(messages);
        all.addAll(more);
        return new ChatRequest(model, systemPrompt, all, temperature, tools, chatId, stream);
    }
}
