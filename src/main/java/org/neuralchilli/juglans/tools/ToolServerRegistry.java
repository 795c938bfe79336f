package org.neuralchilli.juglans.tools;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.juglans.domain.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools offered by the configured external tool servers, addressed as {@code namespace.tool}.
 * Server catalogs are fetched on first use; an unreachable server is skipped with a warning.
 */
@ApplicationScoped
public class ToolServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolServerRegistry.class);

    private final List<ToolServer> servers;
    private final ToolServerClient client;
    private volatile Map<String, ServerTool> tools;

    protected ToolServerRegistry() {
        this.servers = List.of();
        this.client = null;
    }

    @Inject
    public ToolServerRegistry(
            @ConfigProperty(name = "juglans.tool-servers") Optional<List<String>> entries,
            ToolServerClient client
    ) {
        this(entries.orElse(List.of()).stream()
                .filter(entry -> !entry.isBlank())
                .map(ToolServer::parse)
                .toList(), client);
    }

    public ToolServerRegistry(List<ToolServer> servers, ToolServerClient client) {
        this.servers = List.copyOf(servers);
        this.client = client;
    }

    public List<ToolServer> servers() {
        return servers;
    }

    public Optional<ServerTool> find(String qualifiedName) {
        if (servers.isEmpty() || qualifiedName == null || !qualifiedName.contains(".")) {
            return Optional.empty();
        }
        return Optional.ofNullable(catalog().get(qualifiedName));
    }

    public boolean contains(String qualifiedName) {
        return find(qualifiedName).isPresent();
    }

    /**
     * Definitions of every server tool, named {@code namespace.tool}
     */
    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (Map.Entry<String, ServerTool> entry : catalog().entrySet()) {
            ToolDefinition tool = entry.getValue().definition();
            definitions.add(new ToolDefinition(entry.getKey(), tool.description(), tool.parameters()));
        }
        return definitions;
    }

    /**
     * Invoke a server tool by its qualified name
     */
    public String call(ServerTool tool, JsonNode arguments) {
        log.debug("Calling {}.{} on {}", tool.server().namespace(), tool.definition().name(), tool.server().url());
        return client.callTool(tool.server(), tool.definition().name(), arguments);
    }

    /**
     * Forget fetched catalogs; the next lookup fetches them again
     */
    public void refresh() {
        tools = null;
    }

    private Map<String, ServerTool> catalog() {
        Map<String, ServerTool> current = tools;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (tools == null) {
                tools = load();
            }
            return tools;
        }
    }

    private Map<String, ServerTool> load() {
        Map<String, ServerTool> loaded = new LinkedHashMap<>();
        for (ToolServer server : servers) {
            try {
                List<ToolDefinition> offered = client.listTools(server);
                for (ToolDefinition tool : offered) {
                    loaded.put(server.namespace() + "." + tool.name(), new ServerTool(server, tool));
                }
                log.info("Connected to tool server {} ({} tools under '{}')",
                        server.name(), offered.size(), server.namespace());
            } catch (RuntimeException e) {
                log.warn("Failed to list tools of server {} at {}: {}", server.name(), server.url(), e.getMessage());
            }
        }
        return loaded;
    }

    /**
     * A tool together with the server that hosts it
     */
    public record ServerTool(ToolServer server, ToolDefinition definition) {
    }
}
