package com.dataset_analyzer.ml;

import lombok.extern.slf4j.Slf4j;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Flags the most anomalous rows of a standardized matrix with Smile's {@link IsolationForest}.
 * <p>
 * Exactly {@code round(contamination * rows)} rows are flagged: those with the highest anomaly
 * scores, ties going to the earlier row. Smile draws its randomness from a thread-local
 * generator, which is seeded before every fit.
 */
@Slf4j
public final class OutlierDetector {

    // Smile rejects a sampling rate of 1 and trees shallower than 3
    private static final double MAX_SAMPLING_RATE = 0.7;
    private static final int MIN_DEPTH = 3;

    private final int trees;
    private final int maxSubsample;
    private final long seed;

    public OutlierDetector(int trees, int maxSubsample, long seed) {
        this.trees = trees;
        this.maxSubsample = maxSubsample;
        this.seed = seed;
    }

    public boolean[] flag(double[][] points, double contamination) {
        if (points.length == 0) {
            throw new IllegalArgumentException("Cannot detect outliers in zero rows");
        }
        int expected = (int) Math.round(contamination * points.length);
        double[] scores = score(points);
        return flagTop(scores, expected);
    }

    public double[] score(double[][] points) {
        double samplingRate = Math.min(MAX_SAMPLING_RATE, (double) maxSubsample / points.length);
        int subsample = Math.max(1, (int) Math.round(samplingRate * points.length));
        int maxDepth = Math.max(MIN_DEPTH, (int) Math.ceil(Math.log(subsample) / Math.log(2)));

        MathEx.setSeed(seed);
        IsolationForest forest = IsolationForest.fit(points, trees, maxDepth, samplingRate, 0);
        log.debug("Isolation forest: {} trees, subsample {} of {}, depth {}", trees, subsample, points.length, maxDepth);

        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = forest.score(points[i]);
        }
        return scores;
    }

    /**
     * Flags the {@code count} highest-scoring rows. Ties go to the earlier row.
     */
    public static boolean[] flagTop(double[] scores, int count) {
        boolean[] flagged = new boolean[scores.length];
        IntStream.range(0, scores.length)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                        .thenComparingInt(i -> i))
                .limit(Math.max(0, Math.min(count, scores.length)))
                .forEach(i -> flagged[i] = true);
        return flagged;
    }
}
