package io.github.drompincen.eligibility.runtime.agent.llm;

import java.util.Map;

public record ModelReply(String rawText, Map<String, Object> json, boolean failed, String error) {

    public ModelReply {
        rawText = rawText != null ? rawText : "";
        json = json != null ? json : Map.of();
    }

    public static ModelReply of(String rawText, Map<String, Object> json) {
        return new ModelReply(rawText, json, false, null);
    }

    public static ModelReply failure(String error) {
        return new ModelReply("", Map.of(), true, error);
    }

    public boolean hasJson() {
        return !failed && !json.isEmpty();
    }
}
