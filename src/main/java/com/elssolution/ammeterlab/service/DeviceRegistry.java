package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.exception.ConfigException;
import com.elssolution.ammeterlab.integration.emulator.AmmeterEmulator;
import com.elssolution.ammeterlab.integration.emulator.EmulatorHost;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Where each device lives.
 * With embedded emulators the actually bound port wins (matters when a port of 0 was configured).
 */
@Slf4j
@Component
public class DeviceRegistry {

    @Value("${lab.devices.greenlee.host:localhost}") private String greenleeHost;
    @Value("${lab.devices.entes.host:localhost}")    private String entesHost;
    @Value("${lab.devices.circutor.host:localhost}") private String circutorHost;

    @Value("${lab.devices.greenlee.port:5000}")      private int greenleePort;
    @Value("${lab.devices.entes.port:5001}")         private int entesPort;
    @Value("${lab.devices.circutor.port:5002}")      private int circutorPort;

    private final EmulatorHost emulators;

    public DeviceRegistry(EmulatorHost emulators) {
        this.emulators = emulators;
    }

    public DeviceEndpoint endpoint(DeviceKind kind) {
        if (kind == null) throw new ConfigException("device kind is required");
        Optional<AmmeterEmulator> local = emulators.emulator(kind).filter(AmmeterEmulator::isRunning);
        if (local.isPresent()) {
            return DeviceEndpoint.of(kind, emulators.getBindHost(), local.get().getPort());
        }
        return switch (kind) {
            case GREENLEE -> DeviceEndpoint.of(kind, greenleeHost, greenleePort);
            case ENTES -> DeviceEndpoint.of(kind, entesHost, entesPort);
            case CIRCUTOR -> DeviceEndpoint.of(kind, circutorHost, circutorPort);
        };
    }

    /** Endpoints for the given kinds, duplicates dropped, order kept. Empty input means all kinds. */
    public List<DeviceEndpoint> endpoints(Collection<DeviceKind> kinds) {
        Collection<DeviceKind> wanted = (kinds == null || kinds.isEmpty())
                ? List.of(DeviceKind.values())
                : new LinkedHashSet<>(kinds);
        List<DeviceEndpoint> out = new ArrayList<>(wanted.size());
        for (DeviceKind k : wanted) out.add(endpoint(k));
        log.debug("endpoints_resolved {}", out);
        return out;
    }
}
