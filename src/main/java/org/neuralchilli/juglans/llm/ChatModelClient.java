package org.neuralchilli.juglans.llm;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Model collaborator. Implementations must not block the calling thread.
 */
public interface ChatModelClient {

    /**
     * Run one model turn
     *
     * @param tokens receives content fragments as they arrive when {@link ChatRequest#stream()} is set
     */
    CompletableFuture<ChatOutcome> chat(ChatRequest request, Consumer<String> tokens);
}
