package com.cratemind.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link ClassificationBackend} for a provider identifier.
 * Selection happens once per run; nothing downstream branches on the provider.
 */
@Component
public class BackendFactory {

    private static final Logger log = LoggerFactory.getLogger(BackendFactory.class);

    private final LlmProperties properties;

    public BackendFactory(LlmProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates a backend for the configured provider.
     */
    public ClassificationBackend create() {
        return create(properties.getProvider());
    }

    /**
     * Creates a backend for the given provider identifier.
     *
     * @throws ClassifierConfigurationException if the identifier is unsupported or the
     *                                           provider's API key is not configured
     */
    public ClassificationBackend create(String providerId) {
        LlmProvider provider = LlmProvider.fromId(providerId);
        if (!properties.hasKeyFor(provider)) {
            throw new ClassifierConfigurationException(
                    provider.credentialVariable() + " environment variable not set");
        }
        String apiKey = properties.apiKeyFor(provider);
        ClassificationBackend backend = switch (provider) {
            case OPENAI -> OpenAiBackend.create(apiKey);
            case ANTHROPIC -> AnthropicBackend.create(apiKey);
        };
        log.info("Classification backend ready: {} ({})", provider.id(), backend.model());
        return backend;
    }
}
