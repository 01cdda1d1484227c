package com.elssolution.ammeterlab.exception;

/** Two runs cannot be compared (different device kinds or missing statistics). */
public class IncompatibleRunsException extends AmmeterLabException {
    public IncompatibleRunsException(String message) {
        super(ErrorKind.INCOMPATIBLE, message);
    }

    public IncompatibleRunsException(String message, Throwable cause) {
        super(ErrorKind.INCOMPATIBLE, message, cause);
    }
}
