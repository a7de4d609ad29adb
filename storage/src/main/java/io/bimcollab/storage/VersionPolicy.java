// file: storage/src/main/java/io/bimcollab/storage/VersionPolicy.java
package io.bimcollab.storage;

/**
 * Auto-versioning cadence: fold the journal whenever its applied-change
 * count reaches a positive multiple of {@code everyApplied}.
 * <p>
 * Bounds the journal, and therefore the cost of each conflict scan.
 */
public final class VersionPolicy {

    public static final int DEFAULT_EVERY_APPLIED = 10;

    private final int everyApplied;

    public VersionPolicy(int everyApplied) {
        if (everyApplied <= 0) throw new IllegalArgumentException("everyApplied must be > 0");
        this.everyApplied = everyApplied;
    }

    public int everyApplied() {
        return everyApplied;
    }

    /** Call after a change has been applied. */
    public boolean shouldFold(Session session) {
        int applied = session.appliedCount();
        return applied > 0 && applied % everyApplied == 0;
    }
}
