package com.axlabs.neo.governor;

/**
 * Signals that an {@link ActionExecutor} could not complete the invocation of an intent.
 */
public class InvocationException extends Exception {

    public InvocationException(String message) {
        super(message);
    }

    public InvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
