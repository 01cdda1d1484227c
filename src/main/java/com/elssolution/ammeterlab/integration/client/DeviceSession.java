package com.elssolution.ammeterlab.integration.client;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.exception.AmmeterLabException;
import com.elssolution.ammeterlab.exception.DeviceConnectionException;
import com.elssolution.ammeterlab.exception.DeviceTimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps one connection to a device across samples.
 *
 * Transient failures close the connection and retry after a backoff, up to the client's
 * {@code maxRetries}. When the budget is spent the last failure is thrown and
 * {@code DEVICE_UNREACHABLE:<kind>} is raised; the next good reading resolves it.
 */
@Slf4j
public class DeviceSession implements AutoCloseable {

    private final MeasurementClient client;
    private final DeviceEndpoint endpoint;
    private final String alertKey;

    private final Object lock = new Object();
    private DeviceConnection connection;
    private volatile int consecutiveTransient = 0;

    DeviceSession(MeasurementClient client, DeviceEndpoint endpoint) {
        this.client = client;
        this.endpoint = endpoint;
        this.alertKey = "DEVICE_UNREACHABLE:" + endpoint.deviceKind();
    }

    public DeviceEndpoint getEndpoint() {
        return endpoint;
    }

    /**
     * One reading in amps.
     *
     * @throws DeviceConnectionException or {@link DeviceTimeoutException} once retries are exhausted
     * @throws com.elssolution.ammeterlab.exception.ProtocolException    on the first bad reply
     * @throws com.elssolution.ammeterlab.exception.SampleParseException on the first unusable value
     */
    public double readCurrent() {
        AmmeterLabException last = null;
        for (int attempt = 0; attempt <= client.getMaxRetries(); attempt++) {
            if (attempt > 0 && !sleepQuiet(client.backoffFor(attempt - 1))) {
                break;
            }
            try {
                synchronized (lock) {
                    DeviceConnection c = ensureOpen();
                    String raw = client.request(c, endpoint.command());
                    double amps = client.parseSample(raw, endpoint.deviceKind());
                    consecutiveTransient = 0;
                    client.getAlerts().resolve(alertKey);
                    return amps;
                }
            } catch (DeviceTimeoutException | DeviceConnectionException e) {
                last = e;
                consecutiveTransient++;
                closeQuietly();
                log.warn("device_transient kind={} attempt={}/{} streak={}: {}",
                        endpoint.deviceKind(), attempt + 1, client.getMaxRetries() + 1, consecutiveTransient, e.getMessage());
            }
        }
        client.getAlerts().raise(alertKey, last.getMessage(), AlertService.Severity.ERROR);
        throw last;
    }

    @Override
    public void close() {
        closeQuietly();
    }

    private DeviceConnection ensureOpen() {
        if (connection != null && connection.isOpen()) return connection;
        connection = client.connect(endpoint);
        return connection;
    }

    private void closeQuietly() {
        synchronized (lock) {
            if (connection != null) {
                connection.close();
                connection = null;
            }
        }
    }

    private static boolean sleepQuiet(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
