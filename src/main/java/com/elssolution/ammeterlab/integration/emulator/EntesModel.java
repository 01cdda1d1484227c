package com.elssolution.ammeterlab.integration.emulator;

import com.elssolution.ammeterlab.domain.DeviceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/** Hall-effect model: I = B * K with B in [0.01,0.1] T and calibration K in [500,2000]. */
@Slf4j
public final class EntesModel implements MeasurementModel {

    static final double MIN_TESLA = 0.01;
    static final double MAX_TESLA = 0.1;
    static final double MIN_CALIBRATION = 500.0;
    static final double MAX_CALIBRATION = 2000.0;

    @Override
    public DeviceKind kind() {
        return DeviceKind.ENTES;
    }

    @Override
    public double measureCurrent(RandomGenerator rng) {
        double tesla = rng.nextDouble(MIN_TESLA, MAX_TESLA);
        double calibration = rng.nextDouble(MIN_CALIBRATION, MAX_CALIBRATION);
        double amps = current(tesla, calibration);
        if (log.isTraceEnabled()) log.trace("entes B={}T K={} -> I={}A", tesla, calibration, amps);
        return amps;
    }

    public static double current(double tesla, double calibration) {
        return tesla * calibration;
    }
}
