package io.github.drompincen.eligibility.runtime.agent.llm;

import io.github.drompincen.eligibility.runtime.json.JsonRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Wraps {@link LlmService} for stages that expect a JSON object back. A strict-JSON request
 * that fails is retried once in plain mode; the text is always passed through
 * {@link JsonRecovery}. Failures come back as a failed {@link ModelReply}, never as an exception.
 */
@Component
public class StructuredModelClient {

    private static final Logger log = LoggerFactory.getLogger(StructuredModelClient.class);

    private final LlmService llmService;
    private final JsonRecovery jsonRecovery;

    public StructuredModelClient(LlmService llmService, JsonRecovery jsonRecovery) {
        this.llmService = llmService;
        this.jsonRecovery = jsonRecovery;
    }

    public ModelReply request(ModelPrompt prompt) {
        boolean strict = prompt.strictJson() && llmService.supportsStrictJson();
        String text;
        try {
            text = llmService.blockingResponse(strict ? prompt : prompt.withoutStrictJson());
        } catch (UpstreamModelException e) {
            if (!strict) {
                log.warn("[{}] model call failed: {}", prompt.agentId(), e.getMessage());
                return ModelReply.failure(e.getMessage());
            }
            log.warn("[{}] strict JSON call failed, retrying in plain mode: {}", prompt.agentId(), e.getMessage());
            try {
                text = llmService.blockingResponse(prompt.withoutStrictJson());
            } catch (UpstreamModelException retryFailure) {
                log.warn("[{}] plain retry failed: {}", prompt.agentId(), retryFailure.getMessage());
                return ModelReply.failure(retryFailure.getMessage());
            }
        }
        return ModelReply.of(text, jsonRecovery.recover(text));
    }
}
