package com.elssolution.ammeterlab.exception;

/** Persistence failure. Statistics computed before the failure stay valid. */
public class ArchiveException extends AmmeterLabException {
    public ArchiveException(String message) {
        super(ErrorKind.ARCHIVE, message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(ErrorKind.ARCHIVE, message, cause);
    }
}
