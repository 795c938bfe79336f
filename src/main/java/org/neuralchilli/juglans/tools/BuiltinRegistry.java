package org.neuralchilli.juglans.tools;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of in-process tools, first in the dispatch chain.
 */
@ApplicationScoped
public class BuiltinRegistry {

    private static final Logger log = LoggerFactory.getLogger(BuiltinRegistry.class);

    private final Map<String, BuiltinTool> tools = new LinkedHashMap<>();

    protected BuiltinRegistry() {
    }

    @Inject
    public BuiltinRegistry(@Any Instance<BuiltinTool> discovered) {
        List<BuiltinTool> found = new ArrayList<>();
        discovered.forEach(found::add);
        registerAll(found);
    }

    public BuiltinRegistry(List<BuiltinTool> tools) {
        registerAll(tools);
    }

    private void registerAll(List<BuiltinTool> builtins) {
        for (BuiltinTool tool : builtins) {
            register(tool);
        }
        log.info("Registered {} builtin tools: {}", tools.size(), tools.keySet());
    }

    public void register(BuiltinTool tool) {
        BuiltinTool previous = tools.put(tool.name(), tool);
        if (previous != null && previous != tool) {
            log.warn("Builtin tool '{}' registered twice, {} replaces {}",
                    tool.name(), tool.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
    }

    public Optional<BuiltinTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(tools.keySet());
    }
}
