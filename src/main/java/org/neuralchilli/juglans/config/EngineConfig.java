package org.neuralchilli.juglans.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.juglans.llm.ChatSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Produces the engine and chat settings from application configuration.
 */
@ApplicationScoped
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @ConfigProperty(name = "juglans.engine.worker-threads", defaultValue = "4")
    int workerThreads;

    @ConfigProperty(name = "juglans.engine.max-loop-iterations", defaultValue = "100")
    int maxLoopIterations;

    @ConfigProperty(name = "juglans.engine.max-nesting-depth", defaultValue = "10")
    int maxNestingDepth;

    @ConfigProperty(name = "juglans.engine.run-timeout")
    Optional<Duration> runTimeout;

    @ConfigProperty(name = "juglans.bridge.timeout", defaultValue = "PT120S")
    Duration bridgeTimeout;

    @ConfigProperty(name = "juglans.chat.max-tool-turns", defaultValue = "16")
    int maxToolTurns;

    @ConfigProperty(name = "juglans.chat.base-url", defaultValue = "https://api.openai.com/v1")
    String chatBaseUrl;

    @ConfigProperty(name = "juglans.chat.api-key")
    Optional<String> chatApiKey;

    @ConfigProperty(name = "juglans.chat.default-model", defaultValue = "gpt-4o-mini")
    String defaultModel;

    @ConfigProperty(name = "juglans.chat.request-timeout", defaultValue = "PT120S")
    Duration chatRequestTimeout;

    @Produces
    @Singleton
    public EngineSettings engineSettings() {
        EngineSettings settings = new EngineSettings(
                workerThreads,
                maxLoopIterations,
                maxNestingDepth,
                runTimeout.orElse(null),
                bridgeTimeout,
                maxToolTurns
        );
        log.info("Engine configured: {} worker threads, max {} loop iterations, max nesting depth {}, run timeout {}",
                settings.workerThreads(), settings.maxLoopIterations(), settings.maxNestingDepth(),
                settings.runTimeoutIfSet().map(Duration::toString).orElse("none"));
        return settings;
    }

    @Produces
    @Singleton
    public ChatSettings chatSettings() {
        ChatSettings settings = new ChatSettings(chatBaseUrl, chatApiKey.orElse(null), defaultModel, chatRequestTimeout);
        log.info("Chat model endpoint: {} (default model {})", settings.baseUrl(), settings.defaultModel());
        return settings;
    }
}
