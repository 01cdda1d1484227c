package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.domain.AccuracyRanking;
import com.elssolution.ammeterlab.domain.DistributionAnalysis;
import com.elssolution.ammeterlab.domain.Sample;
import com.elssolution.ammeterlab.domain.StatsSnapshot;
import com.elssolution.ammeterlab.domain.TestRun;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Pure statistics over the valid readings of a run.
 *
 * <p>Basic snapshot: mean, median (average of the two middles for even n), sample standard
 * deviation {@code sqrt(sum((x-mean)^2) / (n-1))} (0 for n <= 1), min and max.
 *
 * <p>Distribution analysis adds skewness, excess kurtosis, a 95% Student-t interval for the
 * mean and the number of 1.5 * IQR outliers.
 *
 * <p>Accuracy ranking compares runs of different devices against the median of their medians.
 */
@Slf4j
@Service
public class StatisticsService {

    private static final double CONFIDENCE = 0.95;
    private static final double IQR_FENCE = 1.5;
    static final int MIN_NORMALITY_SAMPLES = 8;
    private static final double NORMALITY_ALPHA = 0.05;

    /** Snapshot over valid samples only; null when there is none. */
    public StatsSnapshot summarize(List<Sample> samples) {
        double[] values = validValues(samples);
        if (values.length == 0) {
            log.debug("stats_skipped: no valid samples out of {}", samples.size());
            return null;
        }
        return compute(values);
    }

    /**
     * @throws IllegalArgumentException if {@code values} is empty or holds a non-finite value
     */
    public StatsSnapshot compute(double[] values) {
        validateInput(values);
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double mean = mean(values);
        return new StatsSnapshot(
                values.length,
                mean,
                medianOfSorted(sorted),
                sampleStdev(values, mean),
                sorted[0],
                sorted[sorted.length - 1]);
    }

    /** Extended analysis over valid samples; null when there is none. */
    public DistributionAnalysis analyze(List<Sample> samples) {
        double[] values = validValues(samples);
        if (values.length == 0) return null;
        return analyze(values);
    }

    public DistributionAnalysis analyze(double[] values) {
        validateInput(values);
        int n = values.length;
        double mean = mean(values);

        double m2 = 0, m3 = 0, m4 = 0;
        for (double v : values) {
            double d = v - mean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
        }
        m2 /= n;
        m3 /= n;
        m4 /= n;
        double skewness = m2 > 0 ? m3 / Math.pow(m2, 1.5) : 0.0;
        double kurtosis = m2 > 0 ? m4 / (m2 * m2) - 3.0 : 0.0;

        double ciLow = mean;
        double ciHigh = mean;
        if (n > 1) {
            double sem = sampleStdev(values, mean) / Math.sqrt(n);
            double t = new TDistribution(n - 1).inverseCumulativeProbability(0.5 + CONFIDENCE / 2);
            ciLow = mean - t * sem;
            ciHigh = mean + t * sem;
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double q1 = percentileOfSorted(sorted, 0.25);
        double q3 = percentileOfSorted(sorted, 0.75);
        double iqr = q3 - q1;
        double lowFence = q1 - IQR_FENCE * iqr;
        double highFence = q3 + IQR_FENCE * iqr;
        int outliers = 0;
        for (double v : values) {
            if (v < lowFence || v > highFence) outliers++;
        }

        Double normalityP = null;
        if (n >= MIN_NORMALITY_SAMPLES && m2 > 0) {
            double jb = n / 6.0 * (skewness * skewness + kurtosis * kurtosis / 4.0);
            normalityP = 1.0 - new ChiSquaredDistribution(2).cumulativeProbability(jb);
        }
        boolean normal = normalityP != null && normalityP > NORMALITY_ALPHA;

        return new DistributionAnalysis(n, skewness, kurtosis, ciLow, ciHigh, q1, q3, outliers, normalityP, normal);
    }

    /**
     * Ranks runs by |median - reference| ascending, ties broken by stdev ascending.
     * Runs without statistics are left out.
     *
     * @throws IllegalArgumentException if no run has statistics
     */
    public AccuracyRanking rankAccuracy(Collection<TestRun> runs) {
        List<TestRun> measured = runs.stream().filter(r -> r.stats() != null).toList();
        if (measured.isEmpty()) {
            throw new IllegalArgumentException("no run with valid samples to rank");
        }

        double[] medians = measured.stream().mapToDouble(r -> r.stats().median()).toArray();
        Arrays.sort(medians);
        double reference = medianOfSorted(medians);

        List<TestRun> ordered = new ArrayList<>(measured);
        ordered.sort(Comparator
                .comparingDouble((TestRun r) -> Math.abs(r.stats().median() - reference))
                .thenComparingDouble(r -> r.stats().stdev()));

        List<AccuracyRanking.Entry> entries = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            TestRun r = ordered.get(i);
            entries.add(new AccuracyRanking.Entry(
                    i + 1, r.runId(), r.deviceKind(), r.stats().median(),
                    Math.abs(r.stats().median() - reference), r.stats().stdev()));
        }
        log.debug("accuracy_ranked runs={} reference={}", entries.size(), reference);
        return new AccuracyRanking(reference, entries);
    }

    // ---------------------- helpers ----------------------

    static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    static double medianOfSorted(double[] sorted) {
        int n = sorted.length;
        int mid = n / 2;
        return (n % 2 == 1) ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    static double sampleStdev(double[] values, double mean) {
        int n = values.length;
        if (n <= 1) return 0.0;
        double ss = 0.0;
        for (double v : values) {
            double d = v - mean;
            ss += d * d;
        }
        return Math.sqrt(ss / (n - 1));
    }

    /** Linear interpolation between closest ranks, position p * (n - 1). */
    static double percentileOfSorted(double[] sorted, double p) {
        double pos = p * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    private static double[] validValues(List<Sample> samples) {
        return samples.stream().filter(Sample::valid).mapToDouble(Sample::value).toArray();
    }

    private static void validateInput(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("need at least one value");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("non-finite value: " + v);
            }
        }
    }
}
