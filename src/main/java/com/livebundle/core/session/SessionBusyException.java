package com.livebundle.core.session;

/**
 * Thrown when a structural operation targets a session whose build is still running.
 */
public class SessionBusyException extends RuntimeException {

    private final String sessionId;

    public SessionBusyException(String sessionId) {
        super("Session " + sessionId + " has a build in progress");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
