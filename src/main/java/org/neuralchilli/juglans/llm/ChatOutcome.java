package org.neuralchilli.juglans.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * What the model answered: final text, or a request to call tools.
 */
public sealed interface ChatOutcome {

    String content();

    String model();

    int tokens();

    /**
     * The model is done; {@code content} is its answer
     */
    record Final(String content, String model, String finishReason, int tokens) implements ChatOutcome {
        public Final {
            content = content != null ? content : "";
        }
    }

    /**
     * The model wants tools called. {@code calls} is the OpenAI {@code tool_calls} array,
     * arguments as JSON strings.
     */
    record ToolCalls(String content, ArrayNode calls, String model, int tokens) implements ChatOutcome {
        public ToolCalls {
            content = content != null ? content : "";
            if (calls == null || calls.isEmpty()) {
                throw new IllegalArgumentException("Tool call outcome requires at least one call");
            }
        }

        /**
         * Assistant message to append to the conversation before the tool results
         */
        public JsonNode assistantMessage() {
            ObjectNode message = calls.objectNode();
            message.put("role", "assistant");
            message.put("content", content);
            message.set("tool_calls", calls.deepCopy());
            return message;
        }
    }
}
