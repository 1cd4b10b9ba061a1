package com.livebundle.core.session;

/**
 * Thrown when the workspace mutex could not be acquired within the configured timeout.
 */
public class WorkspaceMutexTimeoutException extends RuntimeException {
    public WorkspaceMutexTimeoutException(String message) {
        super(message);
    }

    public WorkspaceMutexTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
