package com.elssolution.ammeterlab.integration.emulator;

import com.elssolution.ammeterlab.domain.DeviceKind;

import java.util.random.RandomGenerator;

/** Toy physics behind one emulated ammeter. Inputs are drawn from {@code rng} on every call. */
public interface MeasurementModel {

    DeviceKind kind();

    double measureCurrent(RandomGenerator rng);

    static MeasurementModel forKind(DeviceKind kind) {
        return switch (kind) {
            case GREENLEE -> new GreenleeModel();
            case ENTES -> new EntesModel();
            case CIRCUTOR -> new CircutorModel();
        };
    }
}
