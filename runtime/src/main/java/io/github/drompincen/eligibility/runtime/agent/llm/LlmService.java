package io.github.drompincen.eligibility.runtime.agent.llm;

public interface LlmService {

    /**
     * Sends a single system + user exchange and returns the raw completion text.
     *
     * @throws UpstreamModelException when the provider call fails
     */
    String blockingResponse(ModelPrompt prompt);

    /**
     * Whether the provider can be asked to emit a JSON object natively.
     */
    default boolean supportsStrictJson() { return false; }

    default String getProviderInfo() { return getClass().getSimpleName(); }
}
