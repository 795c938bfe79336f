package org.neuralchilli.juglans.tools;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.juglans.domain.ToolResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tool bundles loaded from the workflow's tool resources, by slug.
 */
@ApplicationScoped
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolResource> bundles = new ConcurrentHashMap<>();

    public void register(ToolResource resource) {
        ToolResource previous = bundles.put(resource.slug(), resource);
        if (previous != null) {
            log.debug("Replaced tool bundle '{}'", resource.slug());
        } else {
            log.debug("Registered tool bundle '{}' with {} tools", resource.slug(), resource.tools().size());
        }
    }

    public Optional<ToolResource> find(String slug) {
        return Optional.ofNullable(bundles.get(slug));
    }

    /**
     * @throws ToolResolutionException when no bundle has this slug
     */
    public ToolResource get(String slug) {
        return find(slug).orElseThrow(() -> new ToolResolutionException(
                "Tool resource '" + slug + "' not found (known: " + slugs() + ")"));
    }

    public Set<String> slugs() {
        return new TreeSet<>(bundles.keySet());
    }

    public void clear() {
        bundles.clear();
    }
}
