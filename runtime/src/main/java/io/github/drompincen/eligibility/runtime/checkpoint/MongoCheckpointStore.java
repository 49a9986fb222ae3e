package io.github.drompincen.eligibility.runtime.checkpoint;

import io.github.drompincen.eligibility.persistence.document.ConversationCheckpointDocument;
import io.github.drompincen.eligibility.persistence.repository.ConversationCheckpointRepository;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "eligibility.checkpoint.store", havingValue = "mongo", matchIfMissing = true)
public class MongoCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(MongoCheckpointStore.class);

    private final ConversationCheckpointRepository repository;
    private final ConversationStateCodec codec;

    public MongoCheckpointStore(ConversationCheckpointRepository repository, ConversationStateCodec codec) {
        this.repository = repository;
        this.codec = codec;
    }

    @Override
    public Optional<ConversationState> get(String sessionId) {
        return repository.findById(sessionId).flatMap(doc -> {
            try {
                return Optional.of(codec.read(doc.getState()));
            } catch (IllegalStateException e) {
                log.error("Unreadable checkpoint for session {}, starting fresh", sessionId, e);
                return Optional.empty();
            }
        });
    }

    /** Saves over the latest stored version, re-reading it once if another writer got in first. */
    @Override
    public void put(String sessionId, ConversationState state) {
        try {
            save(sessionId, state);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Checkpoint for session {} changed concurrently, retrying on the latest version", sessionId);
            save(sessionId, state);
        }
    }

    private void save(String sessionId, ConversationState state) {
        Instant now = Instant.now();
        ConversationCheckpointDocument doc = repository.findById(sessionId).orElseGet(() -> {
            ConversationCheckpointDocument fresh = new ConversationCheckpointDocument();
            fresh.setSessionId(sessionId);
            fresh.setCreatedAt(now);
            return fresh;
        });
        doc.setTurnNo(state.getTurnNo());
        doc.setUpdatedAt(now);
        doc.setState(codec.write(state));
        repository.save(doc);
        log.debug("Saved checkpoint for session {} at turn {}", sessionId, state.getTurnNo());
    }

    @Override
    public boolean delete(String sessionId) {
        if (!repository.existsById(sessionId)) {
            return false;
        }
        repository.deleteById(sessionId);
        return true;
    }
}
