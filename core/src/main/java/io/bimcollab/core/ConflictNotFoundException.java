package io.bimcollab.core;

/** Unknown conflict id, or a conflict that has already been resolved. */
public final class ConflictNotFoundException extends CollaborationException {
    private final String conflictId;

    public ConflictNotFoundException(String conflictId) {
        super("Conflict " + conflictId + " not found");
        this.conflictId = conflictId;
    }

    public String conflictId() { return conflictId; }
}
