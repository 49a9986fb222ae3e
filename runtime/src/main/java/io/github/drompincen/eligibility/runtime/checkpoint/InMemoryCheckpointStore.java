package io.github.drompincen.eligibility.runtime.checkpoint;

import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for tests and single-node demos. States are kept serialized so callers
 * can never alias a stored instance.
 */
@Component
@ConditionalOnProperty(name = "eligibility.checkpoint.store", havingValue = "memory")
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentHashMap<String, String> checkpoints = new ConcurrentHashMap<>();
    private final ConversationStateCodec codec;

    public InMemoryCheckpointStore(ConversationStateCodec codec) {
        this.codec = codec;
    }

    @Override
    public Optional<ConversationState> get(String sessionId) {
        return Optional.ofNullable(checkpoints.get(sessionId)).map(codec::read);
    }

    @Override
    public void put(String sessionId, ConversationState state) {
        checkpoints.put(sessionId, codec.write(state));
    }

    @Override
    public boolean delete(String sessionId) {
        return checkpoints.remove(sessionId) != null;
    }
}
