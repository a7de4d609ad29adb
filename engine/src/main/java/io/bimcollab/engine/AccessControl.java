package io.bimcollab.engine;

import io.bimcollab.core.Permission;
import io.bimcollab.core.PermissionDeniedException;
import io.bimcollab.core.UserNotInSessionException;
import io.bimcollab.storage.Session;

/**
 * Permission checks against a session's role-derived permission sets.
 * Callers hold the store lock.
 */
final class AccessControl {

    private AccessControl() {
        // utility
    }

    /** A user that is not in the session holds no permissions. */
    static void requirePermission(Session session, String userId, Permission permission) {
        if (userId == null || !session.hasPermission(userId, permission)) {
            throw new PermissionDeniedException(userId, permission);
        }
    }

    static void requireMember(Session session, String userId) {
        if (userId == null || !session.hasUser(userId)) {
            throw new UserNotInSessionException(session.sessionId(), userId);
        }
    }
}
