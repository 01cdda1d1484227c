package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.Sample;
import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.domain.StatsSnapshot;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ErrorKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable side of a {@link TestRun} while the scheduler owns it.
 *
 * Samples are only appended by the scheduler's round tasks (one task per recorder per round).
 * {@link #finish} runs exactly once; anything recorded afterwards is dropped.
 */
final class RunRecorder {

    private final String runId;
    private final DeviceEndpoint endpoint;
    private final SamplingConfig config;
    private final Instant createdAt;

    private final List<Sample> samples = new ArrayList<>();
    private int consecutiveFailures = 0;
    private int invalidCount = 0;
    private Instant lastTimestamp;
    private TestRun finished;

    RunRecorder(String runId, DeviceEndpoint endpoint, SamplingConfig config, Instant createdAt) {
        this.runId = runId;
        this.endpoint = endpoint;
        this.config = config;
        this.createdAt = createdAt;
        this.lastTimestamp = createdAt;
    }

    String runId()           { return runId; }
    DeviceEndpoint endpoint() { return endpoint; }

    synchronized void recordOk(int index, Instant at, double amps) {
        if (finished != null) return;
        samples.add(Sample.ok(endpoint.deviceKind(), index, monotonic(at), amps));
        consecutiveFailures = 0;
    }

    synchronized void recordFailure(int index, Instant at, ErrorKind kind) {
        if (finished != null) return;
        samples.add(Sample.failed(endpoint.deviceKind(), index, monotonic(at), kind));
        consecutiveFailures++;
        invalidCount++;
    }

    synchronized boolean thresholdReached() {
        return consecutiveFailures >= config.maxConsecutiveFailures();
    }

    synchronized boolean hasInvalidSamples() {
        return invalidCount > 0;
    }

    synchronized boolean isFinished() {
        return finished != null;
    }

    synchronized List<Sample> samples() {
        return List.copyOf(samples);
    }

    /**
     * @throws IllegalStateException if the run was already finalized or {@code status} is RUNNING
     */
    synchronized TestRun finish(RunStatus status, StatsSnapshot stats, Instant at) {
        if (finished != null) {
            throw new IllegalStateException("run " + runId + " already finalized as " + finished.status());
        }
        if (!status.isTerminal()) {
            throw new IllegalStateException("cannot finalize run " + runId + " as " + status);
        }
        finished = new TestRun(runId, endpoint.deviceKind(), endpoint, config, samples, status, stats,
                createdAt, monotonic(at));
        return finished;
    }

    /** Final run once finished, otherwise a RUNNING view of what was collected so far. */
    synchronized TestRun snapshot() {
        if (finished != null) return finished;
        return new TestRun(runId, endpoint.deviceKind(), endpoint, config, samples, RunStatus.RUNNING, null,
                createdAt, null);
    }

    // wall clock may step back; keep timestamps non-decreasing within the run
    private Instant monotonic(Instant at) {
        if (at.isBefore(lastTimestamp)) at = lastTimestamp;
        lastTimestamp = at;
        return at;
    }
}
