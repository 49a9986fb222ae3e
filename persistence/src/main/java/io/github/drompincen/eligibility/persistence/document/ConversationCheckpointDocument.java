package io.github.drompincen.eligibility.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "conversation_checkpoints")
public class ConversationCheckpointDocument {

    @Id
    private String sessionId;
    private int turnNo;
    private Instant createdAt;
    private Instant updatedAt;
    // Serialized ConversationState; a JSON string avoids _class metadata on nested maps
    private String state;

    @Version
    private Long version;

    public ConversationCheckpointDocument() {}

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public int getTurnNo() { return turnNo; }
    public void setTurnNo(int turnNo) { this.turnNo = turnNo; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
