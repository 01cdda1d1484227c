package com.elssolution.ammeterlab.integration.emulator;

import com.elssolution.ammeterlab.domain.DeviceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/** Ohm's law: I = V / R with V in [1,10] V and R in [0.1,100] ohm. */
@Slf4j
public final class GreenleeModel implements MeasurementModel {

    static final double MIN_VOLTS = 1.0;
    static final double MAX_VOLTS = 10.0;
    static final double MIN_OHMS = 0.1;
    static final double MAX_OHMS = 100.0;

    @Override
    public DeviceKind kind() {
        return DeviceKind.GREENLEE;
    }

    @Override
    public double measureCurrent(RandomGenerator rng) {
        double volts = rng.nextDouble(MIN_VOLTS, MAX_VOLTS);
        double ohms = rng.nextDouble(MIN_OHMS, MAX_OHMS);
        double amps = current(volts, ohms);
        if (log.isTraceEnabled()) log.trace("greenlee V={}V R={}ohm -> I={}A", volts, ohms, amps);
        return amps;
    }

    public static double current(double volts, double ohms) {
        return volts / ohms;
    }
}
