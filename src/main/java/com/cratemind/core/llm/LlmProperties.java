package com.cratemind.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cratemind.llm")
public class LlmProperties {

    private String provider = LlmProvider.OPENAI.id();
    private String openaiApiKey = "";
    private String anthropicApiKey = "";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public void setAnthropicApiKey(String anthropicApiKey) {
        this.anthropicApiKey = anthropicApiKey;
    }

    public boolean hasOpenaiKey() {
        return openaiApiKey != null && !openaiApiKey.isBlank();
    }

    public boolean hasAnthropicKey() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    public String apiKeyFor(LlmProvider provider) {
        return switch (provider) {
            case OPENAI -> openaiApiKey;
            case ANTHROPIC -> anthropicApiKey;
        };
    }

    public boolean hasKeyFor(LlmProvider provider) {
        return switch (provider) {
            case OPENAI -> hasOpenaiKey();
            case ANTHROPIC -> hasAnthropicKey();
        };
    }
}
