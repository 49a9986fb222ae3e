package io.github.drompincen.eligibility.runtime.retrieval;

import io.github.drompincen.eligibility.protocol.api.RetrievedEvidence;

public interface EvidenceRetriever {

    /**
     * Looks up policy passages relevant to the question. Implementations may refuse unsafe
     * queries by returning a safety message with no citations.
     */
    RetrievedEvidence query(String question, String context);
}
