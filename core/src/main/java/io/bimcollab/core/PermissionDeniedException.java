package io.bimcollab.core;

/** The caller's role does not grant the capability an operation needs. */
public final class PermissionDeniedException extends CollaborationException {
    private final String userId;
    private final Permission required;

    public PermissionDeniedException(String userId, Permission required) {
        super("User " + userId + " does not have " + required.wireName() + " permission");
        this.userId = userId;
        this.required = required;
    }

    public String userId() { return userId; }

    public Permission required() { return required; }
}
