package com.elssolution.ammeterlab.exception;

/** Endpoint unreachable, refused, or dropped the connection. */
public class DeviceConnectionException extends AmmeterLabException {
    public DeviceConnectionException(String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public DeviceConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
