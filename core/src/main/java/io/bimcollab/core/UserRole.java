package io.bimcollab.core;

import java.util.Locale;
import java.util.Set;

/**
 * Role of a user inside one collaboration session.
 * The permission set of a role is fixed, see {@link PermissionTable}.
 */
public enum UserRole {
    OWNER, ADMIN, EDITOR, VIEWER, REVIEWER;

    /** Shorthand for {@code PermissionTable.permissionsFor(this)}. */
    public Set<Permission> permissions() {
        return PermissionTable.permissionsFor(this);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
