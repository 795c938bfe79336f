package org.neuralchilli.juglans.tools;

/**
 * An external tool server reachable over JSON-RPC.
 *
 * @param alias optional namespace; tools are addressed as {@code namespace.tool}
 * @param token optional bearer token
 */
public record ToolServer(String name, String url, String alias, String token) {

    public ToolServer {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool server name cannot be null or empty");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Tool server '" + name + "' requires a URL");
        }
        alias = alias != null && !alias.isBlank() ? alias : null;
        token = token != null && !token.isBlank() ? token : null;
    }

    /**
     * Parse a {@code name|url|alias|token} entry; alias and token are optional
     */
    public static ToolServer parse(String entry) {
        if (entry == null || entry.isBlank()) {
            throw new IllegalArgumentException("Tool server entry cannot be empty");
        }
        String[] parts = entry.trim().split("\\|", -1);
        if (parts.length < 2) {
            throw new IllegalArgumentException(
                    "Tool server entry must be 'name|url[|alias[|token]]', got: " + entry);
        }
        return new ToolServer(
                parts[0].trim(),
                parts[1].trim(),
                parts.length > 2 ? parts[2].trim() : null,
                parts.length > 3 ? parts[3].trim() : null
        );
    }

    public String namespace() {
        return alias != null ? alias : name;
    }

    /**
     * Endpoint JSON-RPC messages are posted to
     */
    public String messagesUrl() {
        String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return base.endsWith("/messages") ? base : base + "/messages";
    }
}
