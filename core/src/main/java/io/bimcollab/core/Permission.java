// file: core/src/main/java/io/bimcollab/core/Permission.java
package io.bimcollab.core;

import java.util.Locale;

/**
 * Capabilities a session participant may hold.
 * <p>
 * Wire names are the lower-case constant names ("read", "write", ...) and are
 * what exports and status views show.
 */
public enum Permission {
    READ, WRITE, ADMIN, DELETE, REVIEW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
