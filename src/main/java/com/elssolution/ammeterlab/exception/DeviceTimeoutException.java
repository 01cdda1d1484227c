package com.elssolution.ammeterlab.exception;

/** No reply within the per-request window. */
public class DeviceTimeoutException extends AmmeterLabException {
    public DeviceTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public DeviceTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
