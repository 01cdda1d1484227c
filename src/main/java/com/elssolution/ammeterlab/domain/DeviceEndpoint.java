package com.elssolution.ammeterlab.domain;

import java.util.Objects;

/** Where a device listens and which command string is sent to it. */
public record DeviceEndpoint(DeviceKind deviceKind, String host, int port, String command) {

    public DeviceEndpoint {
        Objects.requireNonNull(deviceKind, "deviceKind");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(command, "command");
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /** Endpoint that sends the kind's own command. */
    public static DeviceEndpoint of(DeviceKind kind, String host, int port) {
        return new DeviceEndpoint(kind, host, port, kind.command());
    }

    public DeviceEndpoint withCommand(String otherCommand) {
        return new DeviceEndpoint(deviceKind, host, port, otherCommand);
    }

    public String address() {
        return host + ":" + port;
    }
}
