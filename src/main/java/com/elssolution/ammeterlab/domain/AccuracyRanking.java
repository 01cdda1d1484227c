package com.elssolution.ammeterlab.domain;

import java.util.List;

/**
 * Runs ranked against a shared reference current. There is no independent ground truth, so the
 * reference is the median of the runs' medians.
 */
public record AccuracyRanking(double referenceValue, List<Entry> entries) {

    public AccuracyRanking {
        entries = List.copyOf(entries);
    }

    public record Entry(int rank,
                        String runId,
                        DeviceKind deviceKind,
                        double median,
                        double deviation,
                        double stdev) {
    }
}
