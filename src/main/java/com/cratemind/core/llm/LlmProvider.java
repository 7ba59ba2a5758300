package com.cratemind.core.llm;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported text-generation providers, keyed by the identifier used in
 * configuration and on the command line.
 */
public enum LlmProvider {

    OPENAI("openai", "OPENAI_API_KEY"),
    ANTHROPIC("anthropic", "ANTHROPIC_API_KEY");

    private final String id;
    private final String credentialVariable;

    LlmProvider(String id, String credentialVariable) {
        this.id = id;
        this.credentialVariable = credentialVariable;
    }

    public String id() {
        return id;
    }

    public String credentialVariable() {
        return credentialVariable;
    }

    /**
     * Resolves a provider identifier, ignoring case and surrounding whitespace.
     *
     * @throws ClassifierConfigurationException if the identifier is not recognized
     */
    public static LlmProvider fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (LlmProvider provider : values()) {
                if (provider.id.equals(normalized)) {
                    return provider;
                }
            }
        }
        throw new ClassifierConfigurationException("Unsupported provider: " + id + ". Use " + supportedIds());
    }

    public static String supportedIds() {
        return Arrays.stream(values())
                .map(p -> "'" + p.id + "'")
                .collect(Collectors.joining(" or "));
    }
}
