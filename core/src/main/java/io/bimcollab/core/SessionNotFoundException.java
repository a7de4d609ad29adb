package io.bimcollab.core;

/** The referenced session id does not exist. */
public final class SessionNotFoundException extends CollaborationException {
    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session " + sessionId + " not found");
        this.sessionId = sessionId;
    }

    public String sessionId() { return sessionId; }
}
