package com.axlabs.neo.governor;

/**
 * Thrown when a governor operation aborts. An aborted operation leaves the governor's state untouched, except for an
 * execution that fails on an intent (see {@link Governor#execute(int)}).
 */
public class GovernorException extends RuntimeException {

    private final ErrorKind kind;
    private final int intentIndex;

    public GovernorException(ErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public GovernorException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public GovernorException(ErrorKind kind, String message, int intentIndex, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.intentIndex = intentIndex;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the index of the intent that failed during execution, or -1 if the failure is not related to a single
     * intent.
     */
    public int getIntentIndex() {
        return intentIndex;
    }
}
