package com.logs.anomaly.engine.isolationforest;

import com.logs.anomaly.engine.feature.FeatureMatrix;
import com.logs.anomaly.exception.ModelNotFittedException;
import com.logs.anomaly.model.AnomalyLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Unsupervised outlier detector over one batch.
 *
 * {@link #fit} grows an {@link IsolationForest} on the batch and sets the decision threshold
 * at the (1 - contamination) percentile of the training scores; {@link #predict} labels rows
 * scoring strictly above that threshold as {@link AnomalyLabel#ANOMALY}.
 *
 * Instances are single-use and not thread-safe: fit mutates the forest, so one instance
 * must never serve two requests. Obtain a fresh one from {@link AnomalyModelFactory}.
 */
public class AnomalyModel {

    private static final Logger log = LoggerFactory.getLogger(AnomalyModel.class);

    private final double contamination;
    private final long seed;
    private final int numTrees;
    private final int maxSamples;

    private IsolationForest forest;
    private double threshold;
    private int fittedWidth;
    private boolean fitted;

    public AnomalyModel(double contamination, long seed, int numTrees, int maxSamples) {
        validateParameters(contamination, numTrees, maxSamples);
        this.contamination = contamination;
        this.seed = seed;
        this.numTrees = numTrees;
        this.maxSamples = maxSamples;
    }

    /**
     * @throws IllegalArgumentException if contamination is outside (0, 0.5] or a size is not positive
     */
    public static void validateParameters(double contamination, int numTrees, int maxSamples) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be positive, got " + numTrees);
        }
        if (maxSamples < 1) {
            throw new IllegalArgumentException("maxSamples must be positive, got " + maxSamples);
        }
    }

    public void fit(FeatureMatrix matrix) {
        double[][] data = matrix.toArray();
        IsolationForest trained = new IsolationForest();
        trained.train(data, numTrees, maxSamples, seed);

        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = trained.anomalyScore(data[i]);
        }

        this.forest = trained;
        this.threshold = percentile(scores, 100.0 * (1.0 - contamination));
        this.fittedWidth = matrix.columnCount();
        this.fitted = true;

        log.debug("Fitted isolation forest: rows={}, columns={}, trees={}, sampleSize={}, threshold={}",
                data.length, fittedWidth, numTrees, trained.getSampleSize(), threshold);
    }

    public double[] score(FeatureMatrix matrix) {
        if (!fitted) {
            throw new ModelNotFittedException();
        }
        if (matrix.columnCount() != fittedWidth) {
            throw new IllegalArgumentException(String.format(
                    "Matrix has %d columns, model was fitted on %d", matrix.columnCount(), fittedWidth));
        }
        double[] scores = new double[matrix.rowCount()];
        double[][] data = matrix.toArray();
        for (int i = 0; i < data.length; i++) {
            scores[i] = forest.anomalyScore(data[i]);
        }
        return scores;
    }

    public List<AnomalyLabel> predict(FeatureMatrix matrix) {
        double[] scores = score(matrix);
        List<AnomalyLabel> labels = new ArrayList<>(scores.length);
        for (double s : scores) {
            labels.add(s > threshold ? AnomalyLabel.ANOMALY : AnomalyLabel.NORMAL);
        }
        return labels;
    }

    public List<AnomalyLabel> fitPredict(FeatureMatrix matrix) {
        fit(matrix);
        return predict(matrix);
    }

    /**
     * Linear-interpolation percentile (q in [0, 100]) of the given values.
     */
    static double percentile(double[] values, double q) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double pos = q / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    public boolean isFitted() { return fitted; }
    public double getThreshold() { return threshold; }
}
