package io.github.drompincen.eligibility.runtime.agent.llm;

import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Anthropic has no JSON response mode, so every call relies on the prompt plus
 * {@link io.github.drompincen.eligibility.runtime.json.JsonRecovery}.
 */
@Service
@ConditionalOnProperty(name = "eligibility.llm.provider", havingValue = "anthropic")
public class AnthropicLlmService extends ChatModelLlmService {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmService.class);

    private final AnthropicChatModel chatModel;

    public AnthropicLlmService(EligibilityProperties properties) {
        super(properties);
        AnthropicApi.Builder api = AnthropicApi.builder()
                .apiKey(settings.apiKey())
                .restClientBuilder(restClientBuilder());
        if (settings.baseUrl() != null && !settings.baseUrl().isBlank()) {
            api.baseUrl(settings.baseUrl());
        }
        this.chatModel = AnthropicChatModel.builder()
                .anthropicApi(api.build())
                .defaultOptions(AnthropicChatOptions.builder()
                        .model(properties.models().decision())
                        .maxTokens(settings.maxTokens())
                        .build())
                .retryTemplate(singleAttempt())
                .build();
        log.info("Anthropic chat model ready (baseUrl={})",
                settings.baseUrl() != null ? settings.baseUrl() : "default");
    }

    @Override
    protected ChatModel chatModel() {
        return chatModel;
    }

    @Override
    protected ChatOptions optionsFor(ModelPrompt prompt) {
        return AnthropicChatOptions.builder()
                .model(prompt.model())
                .temperature(prompt.temperature())
                .maxTokens(settings.maxTokens())
                .build();
    }

    @Override
    public String getProviderInfo() {
        return "Anthropic";
    }
}
