package com.livebundle.core.session;

/**
 * Thrown when a session workspace cannot be materialized from its template.
 */
public class SessionCreationException extends RuntimeException {
    public SessionCreationException(String message) {
        super(message);
    }

    public SessionCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
