package io.bimcollab.core;

import java.util.Locale;

/** Kind of mutation a {@link Change} proposes for one element. */
public enum ChangeType {
    CREATE, UPDATE, DELETE, MOVE, RESIZE, PROPERTY_CHANGE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
