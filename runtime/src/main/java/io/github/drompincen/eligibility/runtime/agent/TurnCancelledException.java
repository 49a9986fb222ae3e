package io.github.drompincen.eligibility.runtime.agent;

public class TurnCancelledException extends RuntimeException {

    public TurnCancelledException(String sessionId) {
        super("Turn cancelled for session " + sessionId);
    }
}
