package com.elssolution.ammeterlab.domain;

import com.elssolution.ammeterlab.exception.ErrorKind;

import java.time.Instant;

/**
 * One timestamped measurement attempt.
 * Invalid samples keep value 0.0 and name the failure in {@code errorKind}.
 */
public record Sample(DeviceKind deviceKind,
                     int index,
                     Instant timestamp,
                     double value,
                     boolean valid,
                     ErrorKind errorKind) {

    public static Sample ok(DeviceKind kind, int index, Instant at, double amps) {
        return new Sample(kind, index, at, amps, true, null);
    }

    public static Sample failed(DeviceKind kind, int index, Instant at, ErrorKind error) {
        return new Sample(kind, index, at, 0.0, false, error);
    }
}
