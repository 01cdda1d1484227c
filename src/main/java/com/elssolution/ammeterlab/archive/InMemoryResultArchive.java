package com.elssolution.ammeterlab.archive;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ArchiveException;
import com.elssolution.ammeterlab.exception.RunNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/** Volatile engine for tests and throwaway sessions (lab.archive.type=memory). */
@Slf4j
@Component
@ConditionalOnProperty(name = "lab.archive.type", havingValue = "memory")
public class InMemoryResultArchive implements ResultArchive {

    static final Comparator<TestRun> NEWEST_FIRST =
            Comparator.comparing(TestRun::createdAt).reversed().thenComparing(TestRun::runId);

    private final ConcurrentHashMap<String, TestRun> runs = new ConcurrentHashMap<>();

    @Override
    public void store(TestRun run) {
        if (run == null) throw new ArchiveException("run is required");
        if (!run.status().isTerminal()) {
            throw new ArchiveException("run " + run.runId() + " is still " + run.status());
        }
        if (runs.putIfAbsent(run.runId(), run) != null) {
            throw new ArchiveException("run id already archived: " + run.runId());
        }
        log.debug("run_archived runId={} kind={} status={}", run.runId(), run.deviceKind(), run.status());
    }

    @Override
    public TestRun get(String runId) {
        TestRun run = runs.get(runId);
        if (run == null) throw new RunNotFoundException(runId);
        return run;
    }

    @Override
    public Stream<TestRun> query(DeviceKind kind, Instant from, Instant to) {
        List<TestRun> matching = new ArrayList<>();
        for (TestRun r : runs.values()) {
            if (matches(r, kind, from, to)) matching.add(r);
        }
        matching.sort(NEWEST_FIRST);
        return matching.stream();
    }

    @Override
    public boolean delete(String runId) {
        return runId != null && runs.remove(runId) != null;
    }

    @Override
    public ArchiveSummary summary() {
        return ArchiveSummary.of(runs.values().stream().map(ArchiveSummary.Entry::of).toList());
    }

    static boolean matches(TestRun r, DeviceKind kind, Instant from, Instant to) {
        if (kind != null && r.deviceKind() != kind) return false;
        if (from != null && r.createdAt().isBefore(from)) return false;
        return to == null || r.createdAt().isBefore(to);
    }
}
