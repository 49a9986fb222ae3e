package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Map;

public record TurnRequest(
        Map<String, Object> donor,
        String question,
        @JsonAlias("session_id") String sessionId
) {
    public TurnRequest {
        donor = donor != null ? donor : Map.of();
        question = question != null ? question : "";
    }
}
