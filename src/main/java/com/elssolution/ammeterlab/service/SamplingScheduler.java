package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.alerts.AlertService;
import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.AmmeterLabException;
import com.elssolution.ammeterlab.exception.ConfigException;
import com.elssolution.ammeterlab.exception.ErrorKind;
import com.elssolution.ammeterlab.integration.client.DeviceSession;
import com.elssolution.ammeterlab.integration.client.MeasurementClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Drives sampling rounds against one or more endpoints.
 *
 * Round i is due at {@code start + i * interval} (absolute deadlines, no drift). Each live
 * endpoint is polled by its own task on the polling executor and the round is joined before
 * the next deadline. A run stops at {@code numSamples}, at the duration bound, on
 * {@code maxConsecutiveFailures} consecutive invalid samples (ABORTED) or on cancellation
 * (INTERRUPTED). Cancellation is checked at every sample boundary and while waiting.
 */
@Slf4j
@Service
public class SamplingScheduler {

    private final MeasurementClient client;
    private final StatisticsService statistics;
    private final AlertService alerts;
    private final ExecutorService pollingExecutor;
    private final Clock clock;

    public SamplingScheduler(MeasurementClient client,
                             StatisticsService statistics,
                             AlertService alerts,
                             @Qualifier("pollingExecutor") ExecutorService pollingExecutor,
                             Clock clock) {
        this.client = client;
        this.statistics = statistics;
        this.alerts = alerts;
        this.pollingExecutor = pollingExecutor;
        this.clock = clock;
    }

    /**
     * Validates the config and allocates one run per endpoint. No device is contacted.
     *
     * @throws ConfigException on an invalid config or an empty endpoint list
     */
    public SamplingPlan plan(List<DeviceEndpoint> endpoints, SamplingConfig config) {
        if (config == null) throw new ConfigException("sampling config is required");
        config.validate();
        if (endpoints == null || endpoints.isEmpty()) {
            throw new ConfigException("at least one device endpoint is required");
        }
        List<RunRecorder> recorders = new ArrayList<>(endpoints.size());
        for (DeviceEndpoint ep : endpoints) {
            recorders.add(new RunRecorder(UUID.randomUUID().toString(), ep, config, clock.instant()));
        }
        return new SamplingPlan(config, recorders);
    }

    public TestRun run(DeviceEndpoint endpoint, SamplingConfig config, CancellationSignal signal) {
        return execute(plan(List.of(endpoint), config), signal).get(0);
    }

    public List<TestRun> run(List<DeviceEndpoint> endpoints, SamplingConfig config, CancellationSignal signal) {
        return execute(plan(endpoints, config), signal);
    }

    /** Blocks until every run of the plan is finalized; returns them in endpoint order. */
    public List<TestRun> execute(SamplingPlan plan, CancellationSignal signal) {
        SamplingConfig cfg = plan.getConfig();
        long interval = cfg.intervalNanos();
        long start = System.nanoTime();

        List<RunRecorder> live = new ArrayList<>(plan.recorders());
        Map<RunRecorder, DeviceSession> sessions = new HashMap<>();
        for (RunRecorder r : live) {
            sessions.put(r, client.openSession(r.endpoint()));
            log.info("run_started runId={} kind={} addr={} samples={} hz={} duration={}s",
                    r.runId(), r.endpoint().deviceKind(), r.endpoint().address(),
                    cfg.numSamples(), cfg.frequencyHz(), cfg.durationSeconds());
        }

        try {
            for (int index = 0; index < cfg.numSamples() && !live.isEmpty(); index++) {
                long offset = index * interval;
                if (cfg.hasTimeBound()
                        && (offset >= cfg.durationNanos() || System.nanoTime() - start >= cfg.durationNanos())) {
                    log.debug("duration_reached after {} rounds", index);
                    break;
                }
                if (waitForDeadline(start + offset, signal)) {
                    interruptAll(live, signal);
                    return finalRuns(plan);
                }

                pollRound(live, sessions, index);

                for (Iterator<RunRecorder> it = live.iterator(); it.hasNext(); ) {
                    RunRecorder r = it.next();
                    if (r.thresholdReached()) {
                        finish(r, RunStatus.ABORTED);
                        alerts.raise("RUN_ABORTED:" + r.endpoint().deviceKind(),
                                "run " + r.runId() + " hit " + cfg.maxConsecutiveFailures() + " consecutive failures",
                                AlertService.Severity.ERROR);
                        it.remove();
                    }
                }
                if (signal.isCancelled()) {
                    interruptAll(live, signal);
                    return finalRuns(plan);
                }
            }

            for (RunRecorder r : live) {
                finish(r, r.hasInvalidSamples() ? RunStatus.DEGRADED : RunStatus.COMPLETED);
                alerts.resolve("RUN_ABORTED:" + r.endpoint().deviceKind());
            }
            return finalRuns(plan);

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            signal.cancel("scheduler thread interrupted");
            interruptAll(live, signal);
            return finalRuns(plan);
        } finally {
            sessions.values().forEach(DeviceSession::close);
        }
    }

    // ---------------------- rounds ----------------------

    private void pollRound(List<RunRecorder> live, Map<RunRecorder, DeviceSession> sessions, int index)
            throws InterruptedException {
        List<Callable<Void>> tasks = new ArrayList<>(live.size());
        for (RunRecorder r : live) {
            DeviceSession session = sessions.get(r);
            tasks.add(() -> {
                pollOnce(r, session, index);
                return null;
            });
        }
        // invokeAll joins every task of the round
        pollingExecutor.invokeAll(tasks);
    }

    private void pollOnce(RunRecorder r, DeviceSession session, int index) {
        try {
            double amps = session.readCurrent();
            r.recordOk(index, clock.instant(), amps);
        } catch (AmmeterLabException e) {
            log.warn("sample_invalid runId={} kind={} index={} error={}: {}",
                    r.runId(), r.endpoint().deviceKind(), index, e.getKind(), e.getMessage());
            r.recordFailure(index, clock.instant(), e.getKind());
        } catch (RuntimeException e) {
            log.error("sample_failed_unexpectedly runId={} index={}", r.runId(), index, e);
            r.recordFailure(index, clock.instant(), ErrorKind.INTERNAL);
        }
    }

    /** Sleeps until the absolute deadline; true if cancelled meanwhile. */
    private static boolean waitForDeadline(long deadlineNanos, CancellationSignal signal) throws InterruptedException {
        if (signal.isCancelled()) return true;
        long remaining = deadlineNanos - System.nanoTime();
        return remaining > 0 && signal.await(remaining);
    }

    // ---------------------- finalization ----------------------

    private void interruptAll(List<RunRecorder> live, CancellationSignal signal) {
        for (RunRecorder r : live) {
            if (!r.isFinished()) {
                log.info("run_interrupted runId={} reason={}", r.runId(), signal.getReason());
                finish(r, RunStatus.INTERRUPTED);
            }
        }
        live.clear();
    }

    private void finish(RunRecorder r, RunStatus status) {
        TestRun run = r.finish(status, statistics.summarize(r.samples()), clock.instant());
        log.info("run_finished runId={} kind={} status={} samples={} valid={}",
                run.runId(), run.deviceKind(), status, run.samples().size(), run.validSampleCount());
    }

    private static List<TestRun> finalRuns(SamplingPlan plan) {
        return plan.recorders().stream().map(RunRecorder::snapshot).toList();
    }
}
