package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RuleCitation(
        @JsonProperty("doc_id") String docId,
        String text
) {
    public RuleCitation {
        text = text != null ? text : "";
    }

    public static RuleCitation of(String docId) {
        return new RuleCitation(docId, "");
    }
}
