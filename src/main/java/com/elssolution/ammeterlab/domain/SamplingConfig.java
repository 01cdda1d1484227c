package com.elssolution.ammeterlab.domain;

import com.elssolution.ammeterlab.exception.ConfigException;

import java.util.concurrent.TimeUnit;

/**
 * Sampling campaign knobs.
 *
 * Stop condition: {@code numSamples} taken OR elapsed wall time >= {@code durationSeconds},
 * whichever comes first. {@code durationSeconds == 0} means no time bound.
 */
public record SamplingConfig(int numSamples,
                             double durationSeconds,
                             double frequencyHz,
                             int maxConsecutiveFailures) {

    private static final double COUNT_TOLERANCE = 1e-3;

    /**
     * Fail fast on anything the scheduler cannot run with.
     *
     * @throws ConfigException describing the first offending field
     */
    public SamplingConfig validate() {
        if (numSamples < 1) {
            throw new ConfigException("numSamples must be >= 1 (was " + numSamples + ")");
        }
        if (!Double.isFinite(durationSeconds) || durationSeconds < 0) {
            throw new ConfigException("durationSeconds must be >= 0 (was " + durationSeconds + ")");
        }
        if (!Double.isFinite(frequencyHz) || frequencyHz <= 0) {
            throw new ConfigException("frequencyHz must be > 0 (was " + frequencyHz + ")");
        }
        if (maxConsecutiveFailures < 1) {
            throw new ConfigException("maxConsecutiveFailures must be >= 1 (was " + maxConsecutiveFailures + ")");
        }
        return this;
    }

    public long intervalNanos() {
        return Math.round(TimeUnit.SECONDS.toNanos(1) / frequencyHz);
    }

    public boolean hasTimeBound() {
        return durationSeconds > 0;
    }

    public long durationNanos() {
        return Math.round(durationSeconds * TimeUnit.SECONDS.toNanos(1));
    }

    /**
     * Builds a config from at least two of count / duration / frequency, deriving the missing one.
     * When all three are given they are kept as-is; the stop condition decides which bound wins.
     *
     * @throws ConfigException if fewer than two are given, a given one is not positive,
     *                         or duration * frequency is not a whole number of samples
     */
    public static SamplingConfig resolve(Integer numSamples,
                                         Double durationSeconds,
                                         Double frequencyHz,
                                         int maxConsecutiveFailures) {
        int provided = (numSamples != null ? 1 : 0)
                + (durationSeconds != null ? 1 : 0)
                + (frequencyHz != null ? 1 : 0);
        if (provided < 2) {
            throw new ConfigException(
                    "sampling config needs at least 2 of: numSamples, durationSeconds, frequencyHz");
        }
        if (numSamples != null && numSamples <= 0) {
            throw new ConfigException("numSamples must be a positive integer (was " + numSamples + ")");
        }
        if (durationSeconds != null && !(durationSeconds > 0)) {
            throw new ConfigException("durationSeconds must be positive (was " + durationSeconds + ")");
        }
        if (frequencyHz != null && !(frequencyHz > 0)) {
            throw new ConfigException("frequencyHz must be positive (was " + frequencyHz + ")");
        }

        int count;
        double duration;
        double frequency;
        if (numSamples == null) {
            double expected = durationSeconds * frequencyHz;
            long rounded = Math.round(expected);
            if (Math.abs(expected - rounded) > COUNT_TOLERANCE || rounded < 1) {
                throw new ConfigException("durationSeconds * frequencyHz must give a whole number of samples (was "
                        + expected + ")");
            }
            count = (int) rounded;
            duration = durationSeconds;
            frequency = frequencyHz;
        } else if (frequencyHz == null) {
            count = numSamples;
            duration = durationSeconds;
            frequency = numSamples / durationSeconds;
        } else if (durationSeconds == null) {
            count = numSamples;
            frequency = frequencyHz;
            duration = numSamples / frequencyHz;
        } else {
            count = numSamples;
            duration = durationSeconds;
            frequency = frequencyHz;
        }
        return new SamplingConfig(count, duration, frequency, maxConsecutiveFailures).validate();
    }
}
