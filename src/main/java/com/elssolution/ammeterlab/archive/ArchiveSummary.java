package com.elssolution.ammeterlab.archive;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.TestRun;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/** Counts over everything currently archived. */
public record ArchiveSummary(int totalRuns,
                             int completedRuns,
                             int otherRuns,
                             double completionRate,
                             Map<DeviceKind, Integer> byDeviceKind) {

    public ArchiveSummary {
        byDeviceKind = Map.copyOf(byDeviceKind);
    }

    static ArchiveSummary of(Collection<Entry> entries) {
        Map<DeviceKind, Integer> perKind = new EnumMap<>(DeviceKind.class);
        int completed = 0;
        for (Entry e : entries) {
            perKind.merge(e.kind(), 1, Integer::sum);
            if (e.status() == RunStatus.COMPLETED) completed++;
        }
        int total = entries.size();
        double rate = total == 0 ? 0.0 : (double) completed / total;
        return new ArchiveSummary(total, completed, total - completed, rate, perKind);
    }

    /** What the summary needs from a run, so engines can answer from their index alone. */
    record Entry(DeviceKind kind, RunStatus status) {
        static Entry of(TestRun run) {
            return new Entry(run.deviceKind(), run.status());
        }
    }
}
