package org.neuralchilli.juglans.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.domain.ErrorCode;
import org.neuralchilli.juglans.domain.PromptTemplate;
import org.neuralchilli.juglans.domain.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt templates loaded from workflow resources, by slug.
 */
@ApplicationScoped
public class PromptRegistry {

    private static final Logger log = LoggerFactory.getLogger(PromptRegistry.class);

    private final Map<String, PromptTemplate> prompts = new ConcurrentHashMap<>();

    public void register(PromptTemplate prompt) {
        prompts.put(prompt.slug(), prompt);
        log.debug("Registered prompt '{}'", prompt.slug());
    }

    public Optional<PromptTemplate> find(String slug) {
        return Optional.ofNullable(prompts.get(slug));
    }

    /**
     * @throws WorkflowException VALIDATION_ERROR when the prompt is unknown
     */
    public PromptTemplate get(String slug) {
        return find(slug).orElseThrow(() -> new WorkflowException(ErrorCode.VALIDATION_ERROR,
                "Prompt '" + slug + "' not found (known: " + slugs() + ")"));
    }

    public Set<String> slugs() {
        return new TreeSet<>(prompts.keySet());
    }

    public void clear() {
        prompts.clear();
    }
}
