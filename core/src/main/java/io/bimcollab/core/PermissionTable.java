// file: core/src/main/java/io/bimcollab/core/PermissionTable.java
package io.bimcollab.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pure mapping from role to capability set.
 * <p>
 * Table:
 *  - OWNER, ADMIN: read, write, admin, delete
 *  - EDITOR:       read, write
 *  - REVIEWER:     read, write, review
 *  - VIEWER:       read
 * <p>
 * A user's effective permissions are always exactly the set of their role.
 * There are no per-user overrides.
 */
public final class PermissionTable {

    private static final Map<UserRole, Set<Permission>> TABLE = new EnumMap<>(UserRole.class);

    static {
        Set<Permission> full = EnumSet.of(Permission.READ, Permission.WRITE, Permission.ADMIN, Permission.DELETE);
        TABLE.put(UserRole.OWNER, Collections.unmodifiableSet(full));
        TABLE.put(UserRole.ADMIN, Collections.unmodifiableSet(EnumSet.copyOf(full)));
        TABLE.put(UserRole.EDITOR, Collections.unmodifiableSet(EnumSet.of(Permission.READ, Permission.WRITE)));
        TABLE.put(UserRole.REVIEWER,
                Collections.unmodifiableSet(EnumSet.of(Permission.READ, Permission.WRITE, Permission.REVIEW)));
        TABLE.put(UserRole.VIEWER, Collections.unmodifiableSet(EnumSet.of(Permission.READ)));
    }

    private PermissionTable() {
        // utility
    }

    /** Immutable permission set for the role. */
    public static Set<Permission> permissionsFor(UserRole role) {
        Objects.requireNonNull(role, "role");
        return TABLE.get(role);
    }

    public static boolean allows(UserRole role, Permission permission) {
        return permissionsFor(role).contains(permission);
    }
}
