package io.github.drompincen.eligibility.runtime.lock;

import io.github.drompincen.eligibility.persistence.document.SessionLockDocument;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Lock shared by every node writing to the same checkpoint collection. Acquire is a conditional
 * upsert keyed by session id; a live lock makes the upsert collide on the id. Locks expire after
 * the turn timeout plus a grace period so a crashed node cannot block a session forever.
 */
@Service
@ConditionalOnProperty(name = "eligibility.checkpoint.store", havingValue = "mongo", matchIfMissing = true)
public class MongoSessionLockService implements SessionLockService {

    private static final Logger log = LoggerFactory.getLogger(MongoSessionLockService.class);
    static final Duration TTL_GRACE = Duration.ofSeconds(30);
    static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final Duration ttl;

    public MongoSessionLockService(MongoTemplate mongoTemplate, EligibilityProperties properties, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.ttl = properties.turn().timeout().plus(TTL_GRACE);
    }

    @Override
    public Optional<String> tryAcquire(String sessionId, Duration wait) {
        String owner = UUID.randomUUID().toString();
        Instant deadline = clock.instant().plus(wait.isNegative() ? Duration.ZERO : wait);
        while (true) {
            if (claim(sessionId, owner)) {
                return Optional.of(owner);
            }
            if (!clock.instant().isBefore(deadline)) {
                return Optional.empty();
            }
            try {
                Thread.sleep(POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public void release(String sessionId, String owner) {
        if (owner == null) {
            return;
        }
        mongoTemplate.remove(Query.query(Criteria.where("_id").is(sessionId)
                .and(SessionLockDocument.OWNER).is(owner)), SessionLockDocument.class);
    }

    @Override
    public boolean isLocked(String sessionId) {
        return mongoTemplate.exists(Query.query(Criteria.where("_id").is(sessionId)
                .and(SessionLockDocument.EXPIRES_AT).gt(clock.instant())), SessionLockDocument.class);
    }

    private boolean claim(String sessionId, String owner) {
        Instant now = clock.instant();
        Query expiredOrAbsent = Query.query(Criteria.where("_id").is(sessionId)
                .and(SessionLockDocument.EXPIRES_AT).lte(now));
        Update take = new Update()
                .set(SessionLockDocument.OWNER, owner)
                .set(SessionLockDocument.ACQUIRED_AT, now)
                .set(SessionLockDocument.EXPIRES_AT, now.plus(ttl));
        try {
            mongoTemplate.upsert(expiredOrAbsent, take, SessionLockDocument.class);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Session {} lock held elsewhere", sessionId);
            return false;
        }
    }
}
