// file: core/src/main/java/io/bimcollab/core/Conflict.java
package io.bimcollab.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Two changes by different users that touched the same element within the
 * detection window.
 * <p>
 * change1 is the change that was already in the journal, change2 the one
 * whose processing revealed the conflict.
 * <p>
 * Resolution fields are written exactly once. Instances are guarded by the
 * session store lock; this class does no locking of its own.
 */
public final class Conflict {

    /** The only conflict type the structural detector produces. */
    public static final String ELEMENT_MODIFICATION = "element_modification";

    private final String conflictId;
    private final String elementId;
    private final Change change1;
    private final Change change2;
    private final String conflictType;
    private final double severity;

    private ResolutionStrategy resolution;
    private String resolvedBy;
    private Instant resolvedAt;

    public Conflict(String conflictId, Change change1, Change change2, String conflictType, double severity) {
        this.conflictId = Objects.requireNonNull(conflictId, "conflictId");
        this.change1 = Objects.requireNonNull(change1, "change1");
        this.change2 = Objects.requireNonNull(change2, "change2");
        if (!change1.sameElement(change2)) {
            throw new IllegalArgumentException("conflicting changes must target the same element");
        }
        if (severity < 0.0 || severity > 1.0) {
            throw new IllegalArgumentException("severity must be in [0,1], got " + severity);
        }
        this.elementId = change1.elementId();
        this.conflictType = Objects.requireNonNull(conflictType, "conflictType");
        this.severity = severity;
    }

    /**
     * Settle this conflict.
     *
     * @throws IllegalStateException if it was already resolved
     */
    public void resolve(ResolutionStrategy strategy, String by, Instant at) {
        if (isResolved()) {
            throw new IllegalStateException("conflict " + conflictId + " already resolved with " + resolution);
        }
        this.resolution = Objects.requireNonNull(strategy, "strategy");
        this.resolvedBy = Objects.requireNonNull(by, "by");
        this.resolvedAt = Objects.requireNonNull(at, "at");
    }

    public boolean isResolved() { return resolution != null; }

    public boolean involves(String changeId) {
        return change1.changeId().equals(changeId) || change2.changeId().equals(changeId);
    }

    public String conflictId() { return conflictId; }

    public String elementId() { return elementId; }

    public String userId1() { return change1.userId(); }

    public String userId2() { return change2.userId(); }

    public Change change1() { return change1; }

    public Change change2() { return change2; }

    public String conflictType() { return conflictType; }

    public double severity() { return severity; }

    /** Null while unresolved. */
    public ResolutionStrategy resolution() { return resolution; }

    public String resolvedBy() { return resolvedBy; }

    public Instant resolvedAt() { return resolvedAt; }

    @Override
    public String toString() {
        return "Conflict{" + conflictId + " element=" + elementId
                + " users=" + userId1() + "/" + userId2()
                + (isResolved() ? " resolution=" + resolution : " unresolved") + "}";
    }
}
