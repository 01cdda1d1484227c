package com.elssolution.ammeterlab.exception;

/** Reply is not a usable number for the device kind. */
public class SampleParseException extends AmmeterLabException {
    public SampleParseException(String message) {
        super(ErrorKind.PARSE, message);
    }

    public SampleParseException(String message, Throwable cause) {
        super(ErrorKind.PARSE, message, cause);
    }
}
