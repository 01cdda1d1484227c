package com.elssolution.ammeterlab.integration.emulator;

import com.elssolution.ammeterlab.domain.DeviceKind;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.random.RandomGenerator;

/**
 * TCP emulator of one ammeter.
 *
 * Wire format: UTF-8 lines. The exact device command gets the current in amps
 * ({@code Double.toString}), anything else gets {@code ERROR unrecognized command: ...}.
 * Connections stay open until the client closes them; a rejected command never stops the service.
 *
 * One accept thread per emulator, one task per accepted connection. Each connection draws from
 * its own generator split off {@code seedSource}; only the accept thread touches the source.
 */
@Slf4j
public class AmmeterEmulator implements AutoCloseable {

    public static final String ERROR_PREFIX = "ERROR";

    private final MeasurementModel model;
    private final String bindHost;
    private final int requestedPort;
    private final SplittableRandom seedSource;
    private final Thread.UncaughtExceptionHandler uncaughtHandler;

    private final ExecutorService connectionPool;
    private final Set<Socket> openSockets = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connSeq = new AtomicInteger();

    // ---- counters for health/status ----
    private final AtomicLong connectionsAccepted = new AtomicLong();
    private final AtomicLong measurementsServed = new AtomicLong();
    private final AtomicLong commandsRejected = new AtomicLong();

    private volatile ServerSocket server;
    private volatile Thread acceptThread;
    private volatile boolean stopping = false;

    public AmmeterEmulator(MeasurementModel model,
                           String bindHost,
                           int port,
                           long seed,
                           Thread.UncaughtExceptionHandler uncaughtHandler) {
        this.model = model;
        this.bindHost = bindHost;
        this.requestedPort = port;
        this.seedSource = new SplittableRandom(seed);
        this.uncaughtHandler = uncaughtHandler;
        String prefix = "emu-" + model.kind().name().toLowerCase(Locale.ROOT) + "-conn-";
        this.connectionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName(prefix + connSeq.incrementAndGet());
            t.setDaemon(true);
            if (uncaughtHandler != null) t.setUncaughtExceptionHandler(uncaughtHandler);
            return t;
        });
    }

    public AmmeterEmulator(MeasurementModel model, String bindHost, int port, long seed) {
        this(model, bindHost, port, seed, null);
    }

    // ---- Lifecycle ----

    /** Binds the port and starts accepting. Port 0 picks a free port, see {@link #getPort()}. */
    public synchronized void start() throws IOException {
        if (server != null) return;
        if (connectionPool.isShutdown()) {
            throw new IllegalStateException("emulator " + model.kind() + " was closed and cannot be restarted");
        }
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(InetAddress.getByName(bindHost), requestedPort), 50);
        server = ss;
        stopping = false;

        Thread t = new Thread(this::acceptLoop, "emu-" + model.kind().name().toLowerCase(Locale.ROOT) + "-accept");
        t.setDaemon(true);
        if (uncaughtHandler != null) t.setUncaughtExceptionHandler(uncaughtHandler);
        acceptThread = t;
        t.start();
        log.info("emulator_started kind={} host={} port={}", model.kind(), bindHost, ss.getLocalPort());
    }

    @Override
    public synchronized void close() {
        stopping = true;
        ServerSocket ss = server;
        server = null;
        if (ss != null) {
            try {
                ss.close();
            } catch (IOException e) {
                log.warn("emulator_close_failed kind={}: {}", model.kind(), e.toString());
            }
        }
        for (Socket s : openSockets) closeSocket(s);
        connectionPool.shutdownNow();
        try {
            if (!connectionPool.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("emulator_pool_slow_shutdown kind={}", model.kind());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        Thread t = acceptThread;
        if (t != null) t.interrupt();
        if (ss != null) log.info("emulator_stopped kind={}", model.kind());
    }

    // ---- Accept loop ----

    private void acceptLoop() {
        ServerSocket ss = server;
        while (!stopping && ss != null && !ss.isClosed()) {
            try {
                Socket socket = ss.accept();
                connectionsAccepted.incrementAndGet();
                RandomGenerator rng = seedSource.split();
                openSockets.add(socket);
                connectionPool.execute(() -> serve(socket, rng));
            } catch (SocketException e) {
                if (!stopping) log.warn("emulator_accept_failed kind={}: {}", model.kind(), e.toString());
                return;
            } catch (IOException e) {
                log.warn("emulator_accept_failed kind={}: {}", model.kind(), e.toString());
            }
        }
    }

    // Listening -> ParsingCommand -> (Computing | RejectingMalformed) -> Responding -> Listening
    private void serve(Socket socket, RandomGenerator rng) {
        String peer = String.valueOf(socket.getRemoteSocketAddress());
        log.debug("emulator_conn_open kind={} peer={}", model.kind(), peer);
        try (socket;
             BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
             Writer out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8)) {
            String line;
            while (!stopping && (line = in.readLine()) != null) {
                // readLine drops the \n / \r\n terminator; nothing else is stripped
                out.write(respond(line, rng));
                out.write('\n');
                out.flush();
            }
        } catch (IOException e) {
            if (!stopping) log.debug("emulator_conn_io kind={} peer={}: {}", model.kind(), peer, e.toString());
        } finally {
            openSockets.remove(socket);
            log.debug("emulator_conn_closed kind={} peer={}", model.kind(), peer);
        }
    }

    String respond(String command, RandomGenerator rng) {
        if (!model.kind().command().equals(command)) {
            commandsRejected.incrementAndGet();
            log.debug("emulator_rejected kind={} command='{}'", model.kind(), command);
            return ERROR_PREFIX + " unrecognized command: " + command;
        }
        try {
            double amps = model.measureCurrent(rng);
            measurementsServed.incrementAndGet();
            return Double.toString(amps);
        } catch (RuntimeException e) {
            log.warn("emulator_measure_failed kind={}: {}", model.kind(), e.toString());
            return ERROR_PREFIX + " measurement failed";
        }
    }

    private void closeSocket(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            log.debug("emulator_socket_close kind={}: {}", model.kind(), e.toString());
        }
    }

    // ---- State ----

    public DeviceKind getKind()              { return model.kind(); }
    public String getBindHost()              { return bindHost; }
    public boolean isRunning()               { ServerSocket ss = server; return ss != null && !ss.isClosed(); }
    public long getConnectionsAccepted()     { return connectionsAccepted.get(); }
    public long getMeasurementsServed()      { return measurementsServed.get(); }
    public long getCommandsRejected()        { return commandsRejected.get(); }

    /** Actual bound port, or -1 if not started. */
    public int getPort() {
        ServerSocket ss = server;
        return ss == null ? -1 : ss.getLocalPort();
    }
}
