package io.github.drompincen.eligibility.runtime.agent.llm;

public class LlmConfigurationException extends RuntimeException {

    public LlmConfigurationException(String message) {
        super(message);
    }
}
