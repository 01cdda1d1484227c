package com.elssolution.ammeterlab.exception;

/**
 * Base unchecked exception for all lab errors.
 *
 * <p>Subclasses fix the {@link ErrorKind}; the scheduler stores it on invalid samples and
 * {@code ApiExceptionHandler} maps it to an HTTP status.
 */
public class AmmeterLabException extends RuntimeException {

    private final ErrorKind kind;

    public AmmeterLabException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AmmeterLabException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }
}
