package io.bimcollab.core;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Session participant.
 * <p>
 * Permissions are derived from the role when the user is built and never
 * edited afterwards; re-joining with another role builds a new User.
 */
public record User(
        String userId,
        String username,
        String email,
        UserRole role,
        Set<Permission> permissions,
        Instant lastActive
) {
    public User {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(lastActive, "lastActive");
        if (userId.isBlank()) throw new IllegalArgumentException("userId must not be blank");
        permissions = Set.copyOf(permissions);
    }

    /** Build a user whose permissions come from the role table. */
    public static User withRole(String userId, String username, String email, UserRole role, Instant now) {
        return new User(userId, username, email, role, role.permissions(), now);
    }

    public boolean can(Permission permission) {
        return permissions.contains(permission);
    }
}
