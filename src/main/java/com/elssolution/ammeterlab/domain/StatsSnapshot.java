package com.elssolution.ammeterlab.domain;

/** Descriptive statistics over the valid samples of one run. */
public record StatsSnapshot(int count,
                            double mean,
                            double median,
                            double stdev,
                            double min,
                            double max) {
}
