package com.elssolution.ammeterlab.integration.client;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.exception.DeviceConnectionException;
import com.elssolution.ammeterlab.exception.DeviceTimeoutException;
import com.elssolution.ammeterlab.exception.ProtocolException;
import com.elssolution.ammeterlab.exception.SampleParseException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Text-protocol client for the ammeter endpoints.
 *
 * Low-level calls ({@link #connect}, {@link #request}, {@link #parseSample}) throw the raw failure.
 * {@link #openSession} wraps them with the retry policy: timeouts and connection failures are
 * retried with exponential backoff, protocol and parse failures are not.
 */
@Slf4j
@Component
@Getter
public class MeasurementClient {

    private static final String ERROR_PREFIX = "ERROR";
    private static final long MAX_BACKOFF_MS = 5_000;
    // Double.toString shape; rejects Java-only forms such as 5d, 0x1p2 or Infinity
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private final int connectTimeoutMs;
    private final int requestTimeoutMs;
    private final int maxRetries;
    private final long backoffMs;
    private final AlertService alerts;

    public MeasurementClient(@Value("${lab.client.connectTimeoutMs:1000}") int connectTimeoutMs,
                             @Value("${lab.client.requestTimeoutMs:2000}") int requestTimeoutMs,
                             @Value("${lab.client.maxRetries:2}") int maxRetries,
                             @Value("${lab.client.backoffMs:100}") long backoffMs,
                             AlertService alerts) {
        this.connectTimeoutMs = Math.max(1, connectTimeoutMs);
        this.requestTimeoutMs = Math.max(1, requestTimeoutMs);
        this.maxRetries = Math.max(0, maxRetries);
        this.backoffMs = Math.max(0, backoffMs);
        this.alerts = alerts;
    }

    /**
     * Opens a TCP connection with the configured connect and read timeouts.
     *
     * @throws DeviceConnectionException if the endpoint is unreachable or refuses
     */
    public DeviceConnection connect(DeviceEndpoint endpoint) {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(requestTimeoutMs);
            socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), connectTimeoutMs);
            BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            Writer out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
            log.debug("device_connected kind={} addr={}", endpoint.deviceKind(), endpoint.address());
            return new DeviceConnection(endpoint, socket, in, out);
        } catch (IOException e) {
            closeQuietly(socket);
            throw new DeviceConnectionException(
                    "cannot connect to " + endpoint.deviceKind() + " at " + endpoint.address() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Sends one command line and reads one reply line.
     *
     * @return the trimmed reply, a single token
     * @throws DeviceTimeoutException    no reply within the request timeout
     * @throws DeviceConnectionException the stream broke or the device hung up
     * @throws ProtocolException         error reply, empty reply or more than one token
     */
    public String request(DeviceConnection connection, String command) {
        DeviceEndpoint ep = connection.getEndpoint();
        String reply;
        try {
            Writer out = connection.out();
            out.write(command);
            out.write('\n');
            out.flush();
            reply = connection.in().readLine();
        } catch (SocketTimeoutException e) {
            throw new DeviceTimeoutException(
                    "no reply from " + ep.deviceKind() + " within " + requestTimeoutMs + " ms", e);
        } catch (IOException e) {
            throw new DeviceConnectionException("I/O error talking to " + ep.deviceKind() + ": " + e.getMessage(), e);
        }

        if (reply == null) {
            throw new DeviceConnectionException(ep.deviceKind() + " closed the connection");
        }
        String trimmed = reply.trim();
        if (trimmed.isEmpty()) {
            throw new ProtocolException("empty reply from " + ep.deviceKind());
        }
        if (trimmed.startsWith(ERROR_PREFIX)) {
            throw new ProtocolException(ep.deviceKind() + " rejected command: " + trimmed);
        }
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            throw new ProtocolException("unexpected reply from " + ep.deviceKind() + ": '" + trimmed + "'");
        }
        return trimmed;
    }

    /**
     * Converts a reply token into amps.
     *
     * @throws SampleParseException non-numeric, non-finite, or outside the kind's plausible range
     */
    public double parseSample(String rawResponse, DeviceKind kind) {
        double amps;
        try {
            String token = rawResponse.trim();
            if (!DECIMAL.matcher(token).matches()) {
                throw new NumberFormatException("not a plain decimal");
            }
            amps = Double.parseDouble(token);
        } catch (NumberFormatException | NullPointerException e) {
            throw new SampleParseException("not a number from " + kind + ": '" + rawResponse + "'", e);
        }
        if (!kind.isPlausible(amps)) {
            throw new SampleParseException(kind + " reading " + amps + " A outside plausible range ["
                    + kind.minPlausibleAmps() + ", " + kind.maxPlausibleAmps() + "]");
        }
        return amps;
    }

    /** Long-lived session for one endpoint; opens lazily and reconnects after transient failures. */
    public DeviceSession openSession(DeviceEndpoint endpoint) {
        return new DeviceSession(this, endpoint);
    }

    long backoffFor(int attempt) {
        long delay = backoffMs << Math.min(attempt, 16);
        return Math.min(MAX_BACKOFF_MS, delay);
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("socket_close_failed: {}", e.toString());
        }
    }
}
