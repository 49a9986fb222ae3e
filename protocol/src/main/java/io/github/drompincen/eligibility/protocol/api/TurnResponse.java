package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TurnResponse(
        DecisionLabel decision,
        double confidence,
        String rationale,
        @JsonProperty("missing_fields") List<String> missingFields,
        @JsonProperty("safety_flags") List<String> safetyFlags,
        @JsonProperty("rule_citations") List<RuleCitation> ruleCitations,
        @JsonProperty("used_model") String usedModel,
        @JsonProperty("final_status") String finalStatus
) {
    public static TurnResponse of(Decision d) {
        return new TurnResponse(d.label(), d.confidence(), d.rationale(), d.missingFields(),
                d.safetyFlags(), d.ruleCitations(), d.usedModel() != null ? d.usedModel() : "",
                d.finalStatus() != null ? d.finalStatus() : d.label().display());
    }
}
