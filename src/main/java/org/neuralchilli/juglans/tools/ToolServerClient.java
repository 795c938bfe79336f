package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.neuralchilli.juglans.domain.ToolDefinition;

import java.util.List;

/**
 * Transport to external tool servers.
 */
public interface ToolServerClient {

    List<ToolDefinition> listTools(ToolServer server);

    /**
     * Invoke a tool and return its textual result
     *
     * @throws CallFailureException when the server cannot be reached or reports an error
     */
    String callTool(ToolServer server, String toolName, JsonNode arguments);
}
