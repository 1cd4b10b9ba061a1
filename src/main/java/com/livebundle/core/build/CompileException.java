package com.livebundle.core.build;

/**
 * Thrown by a {@link Compiler} when a bundle cannot be produced.
 */
public class CompileException extends Exception {
    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
