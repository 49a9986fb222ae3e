package io.github.drompincen.eligibility.runtime.lock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Process-local lock for the in-memory profile. An entry lives only while some thread holds or
 * waits for it.
 */
@Service
@ConditionalOnProperty(name = "eligibility.checkpoint.store", havingValue = "memory")
public class InMemorySessionLockService implements SessionLockService {

    private final ConcurrentHashMap<String, SessionLock> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<String> tryAcquire(String sessionId, Duration wait) {
        SessionLock lock = retain(sessionId);
        boolean acquired = false;
        try {
            acquired = lock.permit.tryAcquire(Math.max(0, wait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!acquired) {
            unretain(sessionId);
            return Optional.empty();
        }
        String owner = UUID.randomUUID().toString();
        lock.owner = owner;
        return Optional.of(owner);
    }

    @Override
    public void release(String sessionId, String owner) {
        SessionLock lock = locks.get(sessionId);
        if (lock == null || owner == null) {
            return;
        }
        boolean released = false;
        synchronized (lock) {
            if (owner.equals(lock.owner)) {
                lock.owner = null;
                lock.permit.release();
                released = true;
            }
        }
        if (released) {
            unretain(sessionId);
        }
    }

    @Override
    public boolean isLocked(String sessionId) {
        SessionLock lock = locks.get(sessionId);
        return lock != null && lock.owner != null;
    }

    int trackedSessions() {
        return locks.size();
    }

    private SessionLock retain(String sessionId) {
        return locks.compute(sessionId, (id, lock) -> {
            SessionLock held = lock != null ? lock : new SessionLock();
            held.users++;
            return held;
        });
    }

    private void unretain(String sessionId) {
        locks.computeIfPresent(sessionId, (id, lock) -> --lock.users == 0 ? null : lock);
    }

    private static final class SessionLock {
        private final Semaphore permit = new Semaphore(1, true);
        private volatile String owner;
        // holders plus waiters; only touched inside compute
        private int users;
    }
}
