package com.cratemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.retry.support.RetryTemplate;

/**
 * Base for backends that reach their provider through a Spring AI {@link ChatClient}.
 * <p>
 * Subclasses supply the provider-specific request options (model, temperature,
 * reply length) and the way reply text is pulled out of the {@link ChatResponse}.
 * Every failure raised by the client, and any reply without text, surfaces as a
 * {@link BackendTransportException}.
 */
public abstract class ChatModelBackend implements ClassificationBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatModelBackend.class);

    public static final double TEMPERATURE = 0.1;
    public static final int MAX_TOKENS = 500;

    private final ChatClient chatClient;

    protected ChatModelBackend(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String send(String prompt) {
        log.debug("{} call started ({} prompt chars)", provider().id(), prompt.length());
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatClient.prompt()
                    .user(prompt)
                    .options(requestOptions())
                    .call()
                    .chatResponse();
        } catch (RuntimeException e) {
            throw new BackendTransportException(
                    provider().id() + " request to " + model() + " failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("{} call complete → {} ({}s)", provider().id(), model(), String.format("%.1f", elapsed / 1000.0));

        String text = response != null ? unwrap(response) : null;
        if (text == null || text.isBlank()) {
            throw new BackendTransportException(provider().id() + " returned no reply text from " + model());
        }
        return text;
    }

    /**
     * Per-request options carried in the provider's request envelope.
     */
    protected abstract ChatOptions requestOptions();

    /**
     * Extracts the raw reply text from the provider's response envelope.
     * May return null when the envelope holds no text.
     */
    protected abstract String unwrap(ChatResponse response);

    /**
     * Spring AI retries failed HTTP calls on its own by default; the classifier
     * owns the attempt budget, so each backend call is made exactly once.
     */
    protected static RetryTemplate singleAttempt() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }
}
