package com.elssolution.ammeterlab.integration.client;

import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.net.Socket;

/** Open line-oriented connection to one device. Not thread-safe: one owner at a time. */
@Slf4j
public final class DeviceConnection implements AutoCloseable {

    private final DeviceEndpoint endpoint;
    private final Socket socket;
    private final BufferedReader in;
    private final Writer out;

    DeviceConnection(DeviceEndpoint endpoint, Socket socket, BufferedReader in, Writer out) {
        this.endpoint = endpoint;
        this.socket = socket;
        this.in = in;
        this.out = out;
    }

    public DeviceEndpoint getEndpoint() {
        return endpoint;
    }

    public boolean isOpen() {
        return !socket.isClosed();
    }

    Socket socket()       { return socket; }
    BufferedReader in()   { return in; }
    Writer out()          { return out; }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("device_close kind={} addr={}: {}", endpoint.deviceKind(), endpoint.address(), e.toString());
        }
    }
}
