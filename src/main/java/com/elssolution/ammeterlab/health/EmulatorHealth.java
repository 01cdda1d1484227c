package com.elssolution.ammeterlab.health;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.integration.emulator.AmmeterEmulator;
import com.elssolution.ammeterlab.integration.emulator.EmulatorHost;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** UP when emulators are disabled or all three are listening. */
@Component
public class EmulatorHealth implements HealthIndicator {
    private final EmulatorHost emulators;

    public EmulatorHealth(EmulatorHost emulators) { this.emulators = emulators; }

    @Override public Health health() {
        if (!emulators.isEnabled()) {
            return Health.up().withDetail("emulators", "disabled").build();
        }
        Health.Builder b = Health.up();
        boolean allUp = true;
        for (DeviceKind kind : DeviceKind.values()) {
            var emu = emulators.emulator(kind);
            boolean up = emu.map(AmmeterEmulator::isRunning).orElse(false);
            allUp &= up;
            b.withDetail(kind.name().toLowerCase(java.util.Locale.ROOT),
                    up ? "port " + emu.get().getPort() + ", served " + emu.get().getMeasurementsServed() : "down");
        }
        return (allUp ? b : b.down()).build();
    }
}
