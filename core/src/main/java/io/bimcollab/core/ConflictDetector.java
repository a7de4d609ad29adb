// file: core/src/main/java/io/bimcollab/core/ConflictDetector.java
package io.bimcollab.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Structural write-conflict detection.
 * <p>
 * Two changes A and B conflict iff:
 *  - A.elementId == B.elementId, and
 *  - A.userId != B.userId, and
 *  - |A.timestamp - B.timestamp| < window (5 minutes by default).
 * <p>
 * The predicate only looks at timestamps, never at processing order, so the
 * result does not depend on which of the two changes was dequeued first.
 * <p>
 * Detection is a linear scan over the candidate changes. Candidates are the
 * session journal, which the versioning cadence keeps short.
 */
public final class ConflictDetector {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

    /** Severity assigned to element modification conflicts. */
    public static final double DEFAULT_SEVERITY = 0.8;

    private final Duration window;
    private final Supplier<String> ids;

    public ConflictDetector() {
        this(DEFAULT_WINDOW);
    }

    public ConflictDetector(Duration window) {
        this(window, () -> UUID.randomUUID().toString());
    }

    public ConflictDetector(Duration window, Supplier<String> ids) {
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        this.window = window;
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public Duration window() {
        return window;
    }

    /** The conflict predicate. Symmetric in its arguments. */
    public boolean conflicts(Change a, Change b) {
        if (a.changeId().equals(b.changeId())) return false;
        if (!a.sameElement(b)) return false;
        if (a.userId().equals(b.userId())) return false;
        Duration delta = Duration.between(a.timestamp(), b.timestamp()).abs();
        return delta.compareTo(window) < 0;
    }

    /**
     * Compare {@code incoming} against every candidate and build one Conflict
     * per conflicting pair. The incoming change itself is skipped if present.
     *
     * @return conflicts in candidate order; empty when the change is clean
     */
    public List<Conflict> detect(Iterable<Change> candidates, Change incoming) {
        List<Conflict> found = new ArrayList<>();
        for (Change existing : candidates) {
            if (conflicts(existing, incoming)) {
                found.add(new Conflict(
                        ids.get(),
                        existing,
                        incoming,
                        Conflict.ELEMENT_MODIFICATION,
                        DEFAULT_SEVERITY
                ));
            }
        }
        return found;
    }
}
