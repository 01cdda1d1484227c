package com.elssolution.ammeterlab.domain;

import com.elssolution.ammeterlab.exception.ErrorKind;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One sampling campaign against one device.
 *
 * Instances are immutable: the scheduler builds a run through {@code RunRecorder} and only hands
 * out a {@code TestRun} as a snapshot (status RUNNING) or once finalized. {@code stats} is null
 * when the run has no valid sample.
 */
public record TestRun(String runId,
                      DeviceKind deviceKind,
                      DeviceEndpoint endpoint,
                      SamplingConfig config,
                      List<Sample> samples,
                      RunStatus status,
                      StatsSnapshot stats,
                      Instant createdAt,
                      Instant finishedAt) {

    public TestRun {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(deviceKind, "deviceKind");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        samples = (samples == null) ? List.of() : List.copyOf(samples);
    }

    public int validSampleCount() {
        int n = 0;
        for (Sample s : samples) {
            if (s.valid()) n++;
        }
        return n;
    }

    /** Error kind of the most recent invalid sample, or null if every sample was valid. */
    public ErrorKind lastErrorKind() {
        for (int i = samples.size() - 1; i >= 0; i--) {
            Sample s = samples.get(i);
            if (!s.valid()) return s.errorKind();
        }
        return null;
    }
}
