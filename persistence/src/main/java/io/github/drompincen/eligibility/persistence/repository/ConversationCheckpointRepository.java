package io.github.drompincen.eligibility.persistence.repository;

import io.github.drompincen.eligibility.persistence.document.ConversationCheckpointDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ConversationCheckpointRepository extends MongoRepository<ConversationCheckpointDocument, String> {
}
