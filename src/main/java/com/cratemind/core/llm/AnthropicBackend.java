package com.cratemind.core.llm;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Messages-API backend. Each content block of the reply arrives as its own
 * generation; the text blocks are joined in order.
 */
public class AnthropicBackend extends ChatModelBackend {

    public static final String MODEL = "claude-3-5-sonnet-20241022";

    AnthropicBackend(ChatClient chatClient) {
        super(chatClient);
    }

    public static AnthropicBackend create(String apiKey) {
        var api = AnthropicApi.builder()
                .apiKey(apiKey)
                .build();
        var chatModel = AnthropicChatModel.builder()
                .anthropicApi(api)
                .retryTemplate(singleAttempt())
                .build();
        return new AnthropicBackend(ChatClient.create(chatModel));
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.ANTHROPIC;
    }

    @Override
    public String model() {
        return MODEL;
    }

    @Override
    protected ChatOptions requestOptions() {
        return AnthropicChatOptions.builder()
                .model(MODEL)
                .maxTokens(MAX_TOKENS)
                .temperature(TEMPERATURE)
                .build();
    }

    @Override
    protected String unwrap(ChatResponse response) {
        var text = new StringBuilder();
        for (Generation generation : response.getResults()) {
            if (generation.getOutput() != null && generation.getOutput().getText() != null) {
                text.append(generation.getOutput().getText());
            }
        }
        return text.isEmpty() ? null : text.toString();
    }
}
