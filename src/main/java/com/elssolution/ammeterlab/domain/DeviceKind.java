package com.elssolution.ammeterlab.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Supported ammeter families.
 *
 * Each kind fixes its default port, the exact command the emulator answers, and the range a
 * reply must fall into to be accepted as a sample:
 *   GREENLEE  5000  V/R       with V in [1,10], R in [0.1,100]   -> [0.01, 100] A
 *   ENTES     5001  B*K       with B in [0.01,0.1], K in [500,2000] -> [5, 200] A
 *   CIRCUTOR  5002  sum(v*dt) over 10 points, v in [0.1,1], dt in [0.001,0.01] -> [0.001, 0.1] A
 */
public enum DeviceKind {
    GREENLEE(5000, "MEASURE_GREENLEE -get_measurement", 0.01, 100.0),
    ENTES(5001, "MEASURE_ENTES -get_data", 5.0, 200.0),
    CIRCUTOR(5002, "MEASURE_CIRCUTOR -get_measurement", 0.001, 0.1);

    // float noise at the range edges
    private static final double RANGE_SLACK = 1e-9;

    private final int defaultPort;
    private final String command;
    private final double minPlausibleAmps;
    private final double maxPlausibleAmps;

    DeviceKind(int defaultPort, String command, double minPlausibleAmps, double maxPlausibleAmps) {
        this.defaultPort = defaultPort;
        this.command = command;
        this.minPlausibleAmps = minPlausibleAmps;
        this.maxPlausibleAmps = maxPlausibleAmps;
    }

    public int defaultPort()        { return defaultPort; }
    public String command()         { return command; }
    public double minPlausibleAmps() { return minPlausibleAmps; }
    public double maxPlausibleAmps() { return maxPlausibleAmps; }

    public boolean isPlausible(double amps) {
        return Double.isFinite(amps)
                && amps >= minPlausibleAmps - RANGE_SLACK
                && amps <= maxPlausibleAmps + RANGE_SLACK;
    }

    /** Case-insensitive lookup used by config binding and HTTP parameters. */
    @JsonCreator
    public static DeviceKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("device kind must not be blank");
        }
        return DeviceKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
