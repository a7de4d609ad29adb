// file: storage/src/main/java/io/bimcollab/storage/SessionStore.java
package io.bimcollab.storage;

import io.bimcollab.core.SessionNotFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory session map plus the single re-entrant lock that guards it and
 * every Session it holds.
 * <p>
 * Usage:
 * <pre>
 *   store.locked(() -> store.require(id).journalSize());
 * </pre>
 * Accessors throw IllegalStateException when called without the lock, so a
 * missing {@code locked(...)} shows up immediately instead of as a race.
 * <p>
 * One store per engine instance, injected at construction; there is no
 * process-wide singleton.
 */
public final class SessionStore {

    private final Map<String, Session> sessions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /** Run {@code action} while holding the store lock. Re-entrant. */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public void put(Session session) {
        checkLocked();
        Objects.requireNonNull(session, "session");
        if (sessions.putIfAbsent(session.sessionId(), session) != null) {
            throw new IllegalArgumentException("session " + session.sessionId() + " already exists");
        }
    }

    /** @throws SessionNotFoundException if no session has this id */
    public Session require(String sessionId) {
        checkLocked();
        Session s = sessions.get(sessionId);
        if (s == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return s;
    }

    public Optional<Session> find(String sessionId) {
        checkLocked();
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int size() {
        checkLocked();
        return sessions.size();
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("SessionStore accessed without holding its lock");
        }
    }
}
