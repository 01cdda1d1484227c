package com.elssolution.ammeterlab.archive;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.RunComparison;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ArchiveException;
import com.elssolution.ammeterlab.exception.IncompatibleRunsException;
import com.elssolution.ammeterlab.exception.RunNotFoundException;

import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Persistence for finalized runs.
 *
 * <p>Storing an id that is already archived fails; run ids are UUIDs so this only trips on a
 * repeated store of the same run. Only terminal runs can be stored.
 */
public interface ResultArchive {

    /**
     * @throws ArchiveException on I/O failure, a duplicate id or a non-terminal run
     */
    void store(TestRun run);

    /**
     * @throws RunNotFoundException if no run has this id
     * @throws ArchiveException     if the run exists but cannot be read back
     */
    TestRun get(String runId);

    /**
     * Runs matching the filters, most recent ({@code createdAt}) first. Runs are loaded as the
     * stream is consumed. {@code from} is inclusive, {@code to} exclusive; null means unbounded.
     */
    Stream<TestRun> query(DeviceKind kind, Instant from, Instant to);

    default Stream<TestRun> query(DeviceKind kind) {
        return query(kind, null, null);
    }

    /** @return true if a run was removed */
    boolean delete(String runId);

    default Optional<TestRun> latest(DeviceKind kind) {
        try (Stream<TestRun> runs = query(kind, null, null)) {
            return runs.findFirst();
        }
    }

    ArchiveSummary summary();

    /**
     * Per-metric delta B - A.
     *
     * @throws RunNotFoundException      if either id is unknown
     * @throws IncompatibleRunsException if the device kinds differ or a run has no statistics
     */
    default RunComparison compare(String runIdA, String runIdB) {
        TestRun a = get(runIdA);
        TestRun b = get(runIdB);
        if (a.deviceKind() != b.deviceKind()) {
            throw new IncompatibleRunsException("cannot compare " + a.deviceKind() + " run " + runIdA
                    + " with " + b.deviceKind() + " run " + runIdB);
        }
        if (a.stats() == null || b.stats() == null) {
            throw new IncompatibleRunsException("run " + (a.stats() == null ? runIdA : runIdB)
                    + " has no valid samples to compare");
        }
        return RunComparison.between(a, b);
    }
}
