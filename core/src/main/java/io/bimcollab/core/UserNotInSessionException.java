package io.bimcollab.core;

/** The user is not (or no longer) a participant of the session. */
public final class UserNotInSessionException extends CollaborationException {
    private final String sessionId;
    private final String userId;

    public UserNotInSessionException(String sessionId, String userId) {
        super("User " + userId + " not in session " + sessionId);
        this.sessionId = sessionId;
        this.userId = userId;
    }

    public String sessionId() { return sessionId; }

    public String userId() { return userId; }
}
