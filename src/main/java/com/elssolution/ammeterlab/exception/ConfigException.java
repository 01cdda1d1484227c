package com.elssolution.ammeterlab.exception;

/** Invalid sampling configuration; raised before any device is contacted. */
public class ConfigException extends AmmeterLabException {
    public ConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
