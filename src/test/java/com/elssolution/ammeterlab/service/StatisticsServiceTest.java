package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.domain.AccuracyRanking;
import com.elssolution.ammeterlab.domain.DeviceEndpoint;
import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.DistributionAnalysis;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.Sample;
import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.domain.StatsSnapshot;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ErrorKind;
import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticsServiceTest {

    private final StatisticsService stats = new StatisticsService();

    @Test
    void median_odd_and_even() {
        assertThat(stats.compute(new double[]{3, 1, 2}).median()).isEqualTo(2.0);
        assertThat(stats.compute(new double[]{4, 1, 3, 2}).median()).isEqualTo(2.5);
    }

    @Test
    void basic_snapshot() {
        StatsSnapshot s = stats.compute(new double[]{2, 4, 4, 4, 5, 5, 7, 9});
        assertThat(s.count()).isEqualTo(8);
        assertThat(s.mean()).isEqualTo(5.0);
        assertThat(s.min()).isEqualTo(2.0);
        assertThat(s.max()).isEqualTo(9.0);
        // sum of squares 32, n-1 = 7
        assertThat(s.stdev()).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
    }

    @Test
    void stdev_of_single_value_is_zero() {
        StatsSnapshot s = stats.compute(new double[]{42.0});
        assertThat(s.stdev()).isZero();
        assertThat(s.median()).isEqualTo(42.0);
    }

    @Test
    void stdev_is_translation_invariant() {
        double[] xs = {0.12, 0.5, 0.33, 0.91, 0.08};
        double[] shifted = new double[xs.length];
        for (int i = 0; i < xs.length; i++) shifted[i] = xs[i] + 1000.0;
        assertThat(stats.compute(shifted).stdev()).isCloseTo(stats.compute(xs).stdev(), within(1e-9));
    }

    @Test
    void rejects_empty_and_non_finite_input() {
        assertThatThrownBy(() -> stats.compute(new double[0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> stats.compute(new double[]{1, Double.NaN})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void summarize_uses_valid_samples_only() {
        Instant t = Instant.parse("2024-01-01T00:00:00Z");
        List<Sample> samples = List.of(
                Sample.ok(DeviceKind.ENTES, 0, t, 10.0),
                Sample.failed(DeviceKind.ENTES, 1, t, ErrorKind.TIMEOUT),
                Sample.ok(DeviceKind.ENTES, 2, t, 20.0));
        StatsSnapshot s = stats.summarize(samples);
        assertThat(s.count()).isEqualTo(2);
        assertThat(s.mean()).isEqualTo(15.0);

        assertThat(stats.summarize(List.of(Sample.failed(DeviceKind.ENTES, 0, t, ErrorKind.PARSE)))).isNull();
    }

    @Test
    void analysis_of_symmetric_data() {
        DistributionAnalysis a = stats.analyze(new double[]{1, 2, 3, 4, 5});
        assertThat(a.count()).isEqualTo(5);
        assertThat(a.skewness()).isCloseTo(0.0, within(1e-12));
        assertThat(a.q1()).isEqualTo(2.0);
        assertThat(a.q3()).isEqualTo(4.0);
        assertThat(a.outlierCount()).isZero();
        assertThat(a.ci95Low()).isLessThan(3.0);
        assertThat(a.ci95High()).isGreaterThan(3.0);
        // t(4, 0.975) = 2.776; sem = sqrt(2.5)/sqrt(5)
        assertThat(a.ci95High() - 3.0).isCloseTo(2.776 * Math.sqrt(0.5), within(1e-3));
    }

    @Test
    void analysis_flags_outliers() {
        DistributionAnalysis a = stats.analyze(new double[]{10, 10.1, 9.9, 10.05, 9.95, 50});
        assertThat(a.outlierCount()).isEqualTo(1);
        assertThat(a.skewness()).isPositive();
    }

    private static double[] quantiles(RealDistribution d, int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = d.inverseCumulativeProbability((i + 0.5) / n);
        }
        return out;
    }

    @Test
    void bell_shaped_readings_pass_normality() {
        DistributionAnalysis a = stats.analyze(quantiles(new NormalDistribution(5.0, 0.2), 200));
        assertThat(a.normalityPValue()).isGreaterThan(0.05);
        assertThat(a.normal()).isTrue();
    }

    @Test
    void skewed_readings_fail_normality() {
        DistributionAnalysis a = stats.analyze(quantiles(new ExponentialDistribution(1.0), 200));
        assertThat(a.normalityPValue()).isLessThan(0.05);
        assertThat(a.normal()).isFalse();
    }

    @Test
    void normality_needs_enough_varying_samples() {
        DistributionAnalysis few = stats.analyze(new double[]{1, 2, 3, 4, 5});
        assertThat(few.normalityPValue()).isNull();
        assertThat(few.normal()).isFalse();

        DistributionAnalysis flat = stats.analyze(new double[]{2, 2, 2, 2, 2, 2, 2, 2, 2, 2});
        assertThat(flat.normalityPValue()).isNull();
    }

    @Test
    void ranking_uses_median_of_medians_and_breaks_ties_on_stdev() {
        TestRun a = run("a", DeviceKind.GREENLEE, 10.0, 10.0, 10.0);  // median 10, stdev 0
        TestRun b = run("b", DeviceKind.ENTES, 12.0, 12.0, 12.0);     // median 12
        TestRun c = run("c", DeviceKind.CIRCUTOR, 7.0, 8.0, 9.0);     // median 8, stdev 1
        TestRun empty = new TestRun("d", DeviceKind.ENTES, null, null, List.of(), RunStatus.ABORTED, null,
                Instant.EPOCH, Instant.EPOCH);

        AccuracyRanking r = stats.rankAccuracy(List.of(b, c, a, empty));

        assertThat(r.referenceValue()).isEqualTo(10.0);
        // b and c both deviate by 2; b is steadier
        assertThat(r.entries()).extracting(AccuracyRanking.Entry::runId).containsExactly("a", "b", "c");
        assertThat(r.entries()).extracting(AccuracyRanking.Entry::rank).containsExactly(1, 2, 3);
        assertThat(r.entries().get(1).deviation()).isEqualTo(2.0);
        assertThat(r.entries().get(2).deviation()).isEqualTo(2.0);
        assertThat(r.entries().get(1).stdev()).isLessThan(r.entries().get(2).stdev());
    }

    @Test
    void ranking_needs_a_measured_run() {
        TestRun empty = new TestRun("d", DeviceKind.ENTES, null, null, List.of(), RunStatus.ABORTED, null,
                Instant.EPOCH, Instant.EPOCH);
        assertThatThrownBy(() -> stats.rankAccuracy(List.of(empty))).isInstanceOf(IllegalArgumentException.class);
    }

    private TestRun run(String id, DeviceKind kind, double... values) {
        Instant t = Instant.parse("2024-05-01T10:00:00Z");
        List<Sample> samples = new java.util.ArrayList<>();
        for (int i = 0; i < values.length; i++) samples.add(Sample.ok(kind, i, t, values[i]));
        return new TestRun(id, kind, DeviceEndpoint.of(kind, "localhost", kind.defaultPort()),
                new SamplingConfig(values.length, 0, 1, 3), samples, RunStatus.COMPLETED,
                stats.summarize(samples), t, t);
    }
}
