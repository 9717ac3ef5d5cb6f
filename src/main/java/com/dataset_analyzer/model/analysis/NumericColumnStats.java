package com.dataset_analyzer.model.analysis;

/**
 * Descriptive statistics of one numeric column. {@code std} is the sample standard deviation;
 * quartiles interpolate linearly between order statistics.
 */
public record NumericColumnStats(long count, double mean, double std, double min,
                                 double p25, double median, double p75, double max) {
}
