package io.github.drompincen.eligibility.runtime.agent.llm;

public record ModelPrompt(
        String agentId,
        String model,
        String system,
        String user,
        double temperature,
        boolean strictJson
) {
    public ModelPrompt {
        system = system != null ? system : "";
        user = user != null ? user : "";
    }

    public ModelPrompt withoutStrictJson() {
        return new ModelPrompt(agentId, model, system, user, temperature, false);
    }
}
