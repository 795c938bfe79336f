package org.neuralchilli.juglans.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.domain.AgentDefinition;
import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agents loaded from workflow resources, by slug. The agent {@code default} always exists.
 */
@ApplicationScoped
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    public static final String DEFAULT_AGENT = "default";

    private final Map<String, AgentDefinition> agents = new ConcurrentHashMap<>();

    public void register(AgentDefinition agent) {
        if (agents.put(agent.slug(), agent) != null) {
            log.debug("Replaced agent '{}'", agent.slug());
        } else {
            log.debug("Registered agent '{}'", agent.slug());
        }
    }

    public Optional<AgentDefinition> find(String slug) {
        if (slug == null || slug.isBlank()) {
            return find(DEFAULT_AGENT);
        }
        AgentDefinition agent = agents.get(slug);
        if (agent == null && DEFAULT_AGENT.equals(slug)) {
            return Optional.of(AgentDefinition.builder(DEFAULT_AGENT).build());
        }
        return Optional.ofNullable(agent);
    }

    /**
     * @throws WorkflowException VALIDATION_ERROR when the agent is unknown
     */
    public AgentDefinition get(String slug) {
        return find(slug).orElseThrow(() -> new WorkflowException(ErrorCode.VALIDATION_ERROR,
                "Agent '" + slug + "' not found (known: " + slugs() + ")"));
    }

    public Set<String> slugs() {
        return new TreeSet<>(agents.keySet());
    }

    public void clear() {
        agents.clear();
    }
}
