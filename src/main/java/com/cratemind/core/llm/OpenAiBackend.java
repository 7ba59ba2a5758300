package com.cratemind.core.llm;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Chat-completions backend. The reply is the message of the first choice.
 */
public class OpenAiBackend extends ChatModelBackend {

    public static final String MODEL = "gpt-4o";

    OpenAiBackend(ChatClient chatClient) {
        super(chatClient);
    }

    public static OpenAiBackend create(String apiKey) {
        var api = OpenAiApi.builder()
                .apiKey(apiKey)
                .build();
        var chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .retryTemplate(singleAttempt())
                .build();
        return new OpenAiBackend(ChatClient.create(chatModel));
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.OPENAI;
    }

    @Override
    public String model() {
        return MODEL;
    }

    @Override
    protected ChatOptions requestOptions() {
        return OpenAiChatOptions.builder()
                .model(MODEL)
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();
    }

    @Override
    protected String unwrap(ChatResponse response) {
        Generation first = response.getResult();
        if (first == null || first.getOutput() == null) {
            return null;
        }
        return first.getOutput().getText();
    }
}
