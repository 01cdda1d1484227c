package com.elssolution.ammeterlab.exception;

/** Reply does not follow the device grammar (error line, empty or garbled). */
public class ProtocolException extends AmmeterLabException {
    public ProtocolException(String message) {
        super(ErrorKind.PROTOCOL, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorKind.PROTOCOL, message, cause);
    }
}
