package io.bimcollab.core;

import java.util.Locale;

/**
 * Strategies for settling a {@link Conflict}.
 * <p>
 *  - MANUAL:           mark resolved, no mutation; the final value is supplied out of band.
 *  - AUTOMATIC:        currently an alias of LAST_WRITER_WINS.
 *  - LAST_WRITER_WINS: keep the change with the later timestamp, discard the other.
 *  - MERGE:            shallow-merge both newValue maps into one synthetic change.
 *  - REJECT:           apply neither change.
 */
public enum ResolutionStrategy {
    MANUAL, AUTOMATIC, LAST_WRITER_WINS, MERGE, REJECT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
