package com.elssolution.ammeterlab.domain;

/**
 * Shape of a run's valid readings beyond the basic snapshot.
 * Moments are the biased (population) estimators; the interval is Student-t at 95%.
 * Normality is a Jarque-Bera test: {@code normalityPValue} is null below
 * {@code StatisticsService.MIN_NORMALITY_SAMPLES} values or for constant data, and
 * {@code normal} means p &gt; 0.05.
 */
public record DistributionAnalysis(int count,
                                   double skewness,
                                   double excessKurtosis,
                                   double ci95Low,
                                   double ci95High,
                                   double q1,
                                   double q3,
                                   int outlierCount,
                                   Double normalityPValue,
                                   boolean normal) {
}
