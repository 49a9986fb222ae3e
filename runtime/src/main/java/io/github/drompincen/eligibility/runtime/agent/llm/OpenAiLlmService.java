package io.github.drompincen.eligibility.runtime.agent.llm;

import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "eligibility.llm.provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiLlmService extends ChatModelLlmService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmService.class);

    private final OpenAiChatModel chatModel;

    public OpenAiLlmService(EligibilityProperties properties) {
        super(properties);
        OpenAiApi.Builder api = OpenAiApi.builder()
                .apiKey(settings.apiKey())
                .restClientBuilder(restClientBuilder());
        if (settings.baseUrl() != null && !settings.baseUrl().isBlank()) {
            api.baseUrl(settings.baseUrl());
        }
        this.chatModel = OpenAiChatModel.builder()
                .openAiApi(api.build())
                .defaultOptions(OpenAiChatOptions.builder().model(properties.models().decision()).build())
                .retryTemplate(singleAttempt())
                .build();
        log.info("OpenAI chat model ready (baseUrl={}, strictJson={})",
                settings.baseUrl() != null ? settings.baseUrl() : "default", settings.strictJson());
    }

    @Override
    protected ChatModel chatModel() {
        return chatModel;
    }

    @Override
    protected ChatOptions optionsFor(ModelPrompt prompt) {
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .model(prompt.model())
                .temperature(prompt.temperature())
                .maxTokens(settings.maxTokens());
        if (prompt.strictJson()) {
            options.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
        }
        return options.build();
    }

    @Override
    public boolean supportsStrictJson() {
        return Boolean.TRUE.equals(settings.strictJson());
    }

    @Override
    public String getProviderInfo() {
        return "OpenAI";
    }
}
