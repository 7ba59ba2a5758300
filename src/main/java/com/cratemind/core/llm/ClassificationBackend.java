package com.cratemind.core.llm;

/**
 * A text-generation backend that turns one prompt into one raw reply.
 * <p>
 * Implementations hold only a fixed client handle and are shared by every batch
 * and attempt of a run.
 */
public interface ClassificationBackend {

    /**
     * Sends the prompt and returns the reply text.
     *
     * @throws BackendTransportException on network, authentication or rate-limit
     *                                   failures, or when the reply carries no text
     */
    String send(String prompt);

    /**
     * Provider this backend talks to.
     */
    LlmProvider provider();

    /**
     * Fixed model identifier sent with every request.
     */
    String model();
}
