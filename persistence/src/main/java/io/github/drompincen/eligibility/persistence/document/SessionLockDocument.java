package io.github.drompincen.eligibility.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One lock per session. The session id is the document id, so a second holder can only get in
 * through an update that matches an expired lock.
 */
@Document(collection = "session_locks")
public class SessionLockDocument {

    public static final String OWNER = "owner";
    public static final String ACQUIRED_AT = "acquiredAt";
    public static final String EXPIRES_AT = "expiresAt";

    @Id
    private String sessionId;
    private String owner;
    private Instant acquiredAt;

    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;

    public SessionLockDocument() {}

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public Instant getAcquiredAt() { return acquiredAt; }
    public void setAcquiredAt(Instant acquiredAt) { this.acquiredAt = acquiredAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
