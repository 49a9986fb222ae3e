package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Answer text and citations returned by an evidence retriever. A citation is either a bare
 * document identifier or a map carrying at least a {@code doc_id} key.
 */
public record RetrievedEvidence(
        String text,
        List<Object> citations
) {
    public RetrievedEvidence {
        text = text != null ? text : "";
        citations = citations != null ? new ArrayList<>(citations) : new ArrayList<>();
    }

    public static RetrievedEvidence empty() {
        return new RetrievedEvidence("", List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return text.isBlank() && citations.isEmpty();
    }
}
