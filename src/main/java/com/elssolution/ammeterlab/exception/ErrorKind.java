package com.elssolution.ammeterlab.exception;

/** Failure categories recorded on invalid samples and carried by every lab exception. */
public enum ErrorKind {
    CONNECTION(true),
    TIMEOUT(true),
    PROTOCOL(false),
    PARSE(false),
    CONFIG(false),
    ARCHIVE(false),
    NOT_FOUND(false),
    INCOMPATIBLE(false),
    INTERNAL(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /** Transient kinds are retried by the client before they reach the scheduler. */
    public boolean isTransient() {
        return transientFailure;
    }
}
