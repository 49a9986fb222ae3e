package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical eligibility decision. Instances are produced by the decision normalizer, so the
 * label is always one of the four canonical values and confidence lies in [0,1].
 */
public record Decision(
        @JsonProperty("decision") DecisionLabel label,
        double confidence,
        String rationale,
        @JsonProperty("missing_fields") List<String> missingFields,
        @JsonProperty("safety_flags") List<String> safetyFlags,
        @JsonProperty("rule_citations") List<RuleCitation> ruleCitations,
        @JsonProperty("used_model") String usedModel,
        @JsonProperty("final_status") String finalStatus
) {
    public static final int MAX_MISSING_FIELDS = 3;

    public Decision {
        label = label != null ? label : DecisionLabel.NEED_MORE_INFO;
        rationale = rationale != null ? rationale : "";
        missingFields = missingFields != null ? List.copyOf(missingFields) : List.of();
        safetyFlags = safetyFlags != null ? List.copyOf(safetyFlags) : List.of();
        ruleCitations = ruleCitations != null ? List.copyOf(ruleCitations) : List.of();
    }

    public static Decision needMoreInfo(double confidence, String rationale) {
        return new Decision(DecisionLabel.NEED_MORE_INFO, confidence, rationale,
                List.of(), List.of(), List.of(), null, null);
    }

    public Decision withLabel(DecisionLabel newLabel) {
        return new Decision(newLabel, confidence, rationale, missingFields, safetyFlags,
                ruleCitations, usedModel, finalStatus);
    }

    public Decision withConfidence(double newConfidence) {
        return new Decision(label, newConfidence, rationale, missingFields, safetyFlags,
                ruleCitations, usedModel, finalStatus);
    }

    public Decision withRationale(String newRationale) {
        return new Decision(label, confidence, newRationale, missingFields, safetyFlags,
                ruleCitations, usedModel, finalStatus);
    }

    public Decision withSafetyFlags(List<String> flags) {
        return new Decision(label, confidence, rationale, missingFields, flags,
                ruleCitations, usedModel, finalStatus);
    }

    public Decision withRuleCitations(List<RuleCitation> citations) {
        return new Decision(label, confidence, rationale, missingFields, safetyFlags,
                citations, usedModel, finalStatus);
    }

    public Decision withUsedModel(String model) {
        return new Decision(label, confidence, rationale, missingFields, safetyFlags,
                ruleCitations, model, finalStatus);
    }

    public Decision withFinalStatus(String status) {
        return new Decision(label, confidence, rationale, missingFields, safetyFlags,
                ruleCitations, usedModel, status);
    }

    /** Loosely-typed view using the wire keys, the shape the normalizer and reflector work on. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("decision", label.display());
        map.put("confidence", confidence);
        map.put("rationale", rationale);
        map.put("missing_fields", new ArrayList<>(missingFields));
        map.put("safety_flags", new ArrayList<>(safetyFlags));
        List<Map<String, Object>> citations = new ArrayList<>();
        for (RuleCitation c : ruleCitations) {
            Map<String, Object> cm = new LinkedHashMap<>();
            cm.put("doc_id", c.docId());
            cm.put("text", c.text());
            citations.add(cm);
        }
        map.put("rule_citations", citations);
        if (usedModel != null) map.put("used_model", usedModel);
        if (finalStatus != null) map.put("final_status", finalStatus);
        return map;
    }
}
