package com.elssolution.ammeterlab.integration.emulator;

import com.elssolution.ammeterlab.domain.DeviceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * Rogowski coil, discrete integration: I = sum(v_i * dt_i) over {@link #POINTS} points,
 * v_i in [0.1,1.0] V, each with its own dt_i in [0.001,0.01] s.
 */
@Slf4j
public final class CircutorModel implements MeasurementModel {

    static final int POINTS = 10;
    static final double MIN_VOLTS = 0.1;
    static final double MAX_VOLTS = 1.0;
    static final double MIN_STEP_S = 0.001;
    static final double MAX_STEP_S = 0.01;

    @Override
    public DeviceKind kind() {
        return DeviceKind.CIRCUTOR;
    }

    @Override
    public double measureCurrent(RandomGenerator rng) {
        double[] volts = new double[POINTS];
        double[] steps = new double[POINTS];
        for (int i = 0; i < POINTS; i++) {
            volts[i] = rng.nextDouble(MIN_VOLTS, MAX_VOLTS);
            steps[i] = rng.nextDouble(MIN_STEP_S, MAX_STEP_S);
        }
        double amps = integrate(volts, steps);
        if (log.isTraceEnabled()) log.trace("circutor points={} -> I={}A", POINTS, amps);
        return amps;
    }

    public static double integrate(double[] volts, double[] steps) {
        if (volts.length != steps.length) {
            throw new IllegalArgumentException("volts/steps length mismatch: " + volts.length + " vs " + steps.length);
        }
        double sum = 0.0;
        for (int i = 0; i < volts.length; i++) {
            sum += volts[i] * steps[i];
        }
        return sum;
    }
}
