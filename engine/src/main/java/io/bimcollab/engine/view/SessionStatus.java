package io.bimcollab.engine.view;

import io.bimcollab.core.User;
import io.bimcollab.core.UserRole;

import java.time.Instant;
import java.util.List;

/**
 * Read-only status snapshot of a session.
 * conflictCount includes resolved conflicts; unresolvedConflictCount does not.
 */
public record SessionStatus(
        String sessionId,
        String modelId,
        int userCount,
        int activeChangeCount,
        int conflictCount,
        int unresolvedConflictCount,
        int versionCount,
        Instant createdAt,
        Instant lastActivity,
        List<Participant> users
) {
    public SessionStatus {
        users = List.copyOf(users);
    }

    public record Participant(String userId, String username, UserRole role, Instant lastActive) {
        public static Participant of(User u) {
            return new Participant(u.userId(), u.username(), u.role(), u.lastActive());
        }
    }
}
