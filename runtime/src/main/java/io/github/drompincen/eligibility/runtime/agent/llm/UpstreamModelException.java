package io.github.drompincen.eligibility.runtime.agent.llm;

/**
 * A model call failed: transport error, provider error response, or an empty completion.
 */
public class UpstreamModelException extends RuntimeException {

    private final String agentId;

    public UpstreamModelException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }

    public UpstreamModelException(String agentId, String message) {
        this(agentId, message, null);
    }

    public String getAgentId() { return agentId; }
}
