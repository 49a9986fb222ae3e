package io.github.drompincen.eligibility.runtime.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Single-writer lock per session id. Acquisition hands out an owner token; only the holder of
 * that token can release.
 */
public interface SessionLockService {

    Optional<String> tryAcquire(String sessionId, Duration wait);

    default Optional<String> tryAcquire(String sessionId) {
        return tryAcquire(sessionId, Duration.ZERO);
    }

    void release(String sessionId, String owner);

    boolean isLocked(String sessionId);
}
