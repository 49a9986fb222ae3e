package io.github.drompincen.eligibility.runtime.checkpoint;

import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;

import java.util.Optional;

/**
 * Per-session persistence of {@link ConversationState}. Every {@code get} returns an
 * independent copy; writes for one session never touch another.
 */
public interface CheckpointStore {

    Optional<ConversationState> get(String sessionId);

    void put(String sessionId, ConversationState state);

    /** Returns true when a checkpoint existed. */
    boolean delete(String sessionId);
}
