package com.elssolution.ammeterlab.integration.emulator;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.alerts.GlobalUncaughtHandler;
import com.elssolution.ammeterlab.domain.DeviceKind;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the three emulators inside the application.
 * Each one gets its own port, accept thread and random stream; a failing bind only takes that device down.
 */
@Slf4j
@Component
public class EmulatorHost {

    @Value("${lab.emulators.enabled:true}")       private boolean enabled;
    @Value("${lab.emulators.bindHost:localhost}") private String bindHost;
    /** Fixed seed makes replies reproducible; empty = seeded from the clock. */
    @Value("${lab.emulators.seed:}")              private String seed;

    @Value("${lab.devices.greenlee.port:5000}")   private int greenleePort;
    @Value("${lab.devices.entes.port:5001}")      private int entesPort;
    @Value("${lab.devices.circutor.port:5002}")   private int circutorPort;

    private final AlertService alerts;
    private final GlobalUncaughtHandler uncaughtHandler;
    private final Map<DeviceKind, AmmeterEmulator> emulators = Collections.synchronizedMap(new EnumMap<>(DeviceKind.class));

    public EmulatorHost(AlertService alerts, GlobalUncaughtHandler uncaughtHandler) {
        this.alerts = alerts;
        this.uncaughtHandler = uncaughtHandler;
    }

    @PostConstruct
    void startAll() {
        if (!enabled) {
            log.info("Embedded emulators disabled (lab.emulators.enabled=false)");
            return;
        }
        long base = (seed == null || seed.isBlank()) ? System.nanoTime() : Long.parseLong(seed.trim());
        for (DeviceKind kind : DeviceKind.values()) {
            AmmeterEmulator emu = new AmmeterEmulator(
                    MeasurementModel.forKind(kind), bindHost, portFor(kind), base + kind.ordinal(), uncaughtHandler);
            try {
                emu.start();
                emulators.put(kind, emu);
                alerts.resolve(alertKey(kind));
            } catch (IOException e) {
                log.error("emulator_bind_failed kind={} port={}: {}", kind, portFor(kind), e.toString());
                alerts.raise(alertKey(kind), "Cannot bind " + bindHost + ":" + portFor(kind) + " (" + e.getMessage() + ")",
                        AlertService.Severity.ERROR);
                emu.close();
            }
        }
    }

    @PreDestroy
    void stopAll() {
        synchronized (emulators) {
            emulators.values().forEach(AmmeterEmulator::close);
            emulators.clear();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getBindHost() {
        return bindHost;
    }

    public Optional<AmmeterEmulator> emulator(DeviceKind kind) {
        return Optional.ofNullable(emulators.get(kind));
    }

    public Collection<AmmeterEmulator> running() {
        synchronized (emulators) {
            return emulators.values().stream().filter(AmmeterEmulator::isRunning).toList();
        }
    }

    private int portFor(DeviceKind kind) {
        return switch (kind) {
            case GREENLEE -> greenleePort;
            case ENTES -> entesPort;
            case CIRCUTOR -> circutorPort;
        };
    }

    private static String alertKey(DeviceKind kind) {
        return "EMULATOR_DOWN:" + kind;
    }
}
