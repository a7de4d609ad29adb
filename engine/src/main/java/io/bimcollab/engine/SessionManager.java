// file: engine/src/main/java/io/bimcollab/engine/SessionManager.java
package io.bimcollab.engine;

import io.bimcollab.core.User;
import io.bimcollab.core.UserNotInSessionException;
import io.bimcollab.core.UserRole;
import io.bimcollab.engine.view.SessionStatus;
import io.bimcollab.storage.Session;
import io.bimcollab.storage.SessionStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Session lifecycle and membership.
 * <p>
 * Joining never requires a permission: any caller may join any existing
 * session with any role. Authentication and invitation live outside the engine.
 */
public final class SessionManager {

    private final SessionStore store;
    private final Clock clock;

    public SessionManager(SessionStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Create a session for {@code modelId} with the caller registered as OWNER.
     *
     * @return the new session id
     */
    public String create(String modelId, String ownerId, String ownerUsername, String ownerEmail) {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(ownerId, "ownerId");
        String sessionId = UUID.randomUUID().toString();
        int open = store.locked(() -> {
            Instant now = clock.instant();
            Session session = new Session(sessionId, modelId, now);
            session.putUser(User.withRole(ownerId, ownerUsername, ownerEmail, UserRole.OWNER, now));
            store.put(session);
            return store.size();
        });
        AuditLogger.logOperation("create-session", sessionId, ownerId, "model=" + modelId + " sessions=" + open);
        return sessionId;
    }

    /** Add or replace a participant. */
    public boolean join(String sessionId, String userId, String username, String email, UserRole role) {
        Objects.requireNonNull(userId, "userId");
        UserRole effective = role == null ? UserRole.VIEWER : role;
        store.locked(() -> {
            Session session = store.require(sessionId);
            Instant now = clock.instant();
            session.putUser(User.withRole(userId, username, email, effective, now));
            session.touch(now);
            return null;
        });
        AuditLogger.logOperation("join-session", sessionId, userId, "role=" + effective.wireName());
        return true;
    }

    public boolean leave(String sessionId, String userId) {
        store.locked(() -> {
            Session session = store.require(sessionId);
            if (!session.removeUser(userId)) {
                throw new UserNotInSessionException(sessionId, userId);
            }
            session.touch(clock.instant());
            return null;
        });
        AuditLogger.logOperation("leave-session", sessionId, userId, null);
        return true;
    }

    public SessionStatus status(String sessionId) {
        return store.locked(() -> {
            Session s = store.require(sessionId);
            return new SessionStatus(
                    s.sessionId(),
                    s.modelId(),
                    s.users().size(),
                    s.journalSize(),
                    s.conflicts().size(),
                    s.unresolvedConflicts().size(),
                    s.versions().size(),
                    s.createdAt(),
                    s.lastActivity(),
                    s.users().stream().map(SessionStatus.Participant::of).toList()
            );
        });
    }
}
