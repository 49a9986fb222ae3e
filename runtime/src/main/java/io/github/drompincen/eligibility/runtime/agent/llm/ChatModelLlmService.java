package io.github.drompincen.eligibility.runtime.agent.llm;

import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Shared call path for Spring AI chat models. Subclasses build the provider model and
 * translate a {@link ModelPrompt} into provider options.
 */
public abstract class ChatModelLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(ChatModelLlmService.class);

    protected final EligibilityProperties.Llm settings;

    protected ChatModelLlmService(EligibilityProperties properties) {
        this.settings = properties.llm();
        if (!settings.hasApiKey()) {
            throw new LlmConfigurationException(
                    "eligibility.llm.api-key is required for provider '" + settings.provider() + "'");
        }
    }

    protected abstract ChatModel chatModel();

    protected abstract ChatOptions optionsFor(ModelPrompt prompt);

    @Override
    public String blockingResponse(ModelPrompt prompt) {
        List<Message> messages = List.of(new SystemMessage(prompt.system()), new UserMessage(prompt.user()));
        ChatResponse response;
        try {
            response = chatModel().call(new Prompt(messages, optionsFor(prompt)));
        } catch (RuntimeException e) {
            throw new UpstreamModelException(prompt.agentId(),
                    prompt.agentId() + " call to " + prompt.model() + " failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new UpstreamModelException(prompt.agentId(), prompt.agentId() + " received an empty completion");
        }
        String text = response.getResult().getOutput().getText();
        log.debug("[{}] {} replied with {} chars", prompt.agentId(), prompt.model(), text != null ? text.length() : 0);
        return text != null ? text : "";
    }

    protected RestClient.Builder restClientBuilder() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(settings.connectTimeout());
        factory.setReadTimeout(settings.readTimeout());
        return RestClient.builder().requestFactory(factory);
    }

    /** Each stage makes exactly one attempt; the caller decides on fallbacks. */
    protected static RetryTemplate singleAttempt() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }
}
