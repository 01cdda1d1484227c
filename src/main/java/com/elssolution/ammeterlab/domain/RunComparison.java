package com.elssolution.ammeterlab.domain;

/** Per-metric change from run A to run B (B minus A). */
public record RunComparison(String runIdA,
                            String runIdB,
                            DeviceKind deviceKind,
                            double meanDelta,
                            double medianDelta,
                            double stdevDelta,
                            double minDelta,
                            double maxDelta) {

    public static RunComparison between(TestRun a, TestRun b) {
        StatsSnapshot sa = a.stats();
        StatsSnapshot sb = b.stats();
        return new RunComparison(
                a.runId(), b.runId(), a.deviceKind(),
                sb.mean() - sa.mean(),
                sb.median() - sa.median(),
                sb.stdev() - sa.stdev(),
                sb.min() - sa.min(),
                sb.max() - sa.max());
    }
}
