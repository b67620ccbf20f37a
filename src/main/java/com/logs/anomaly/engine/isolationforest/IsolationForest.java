package com.logs.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class IsolationForest {

    private List<IsolationTree> trees = Collections.emptyList();
    private int sampleSize;

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest (typically 100)
     * @param maxSamples sub-sampling size per tree (typically 256), capped at the row count
     * @param seed       random seed for reproducibility
     */
    public void train(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train on an empty matrix");
        }
        this.sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = maxDepth(this.sampleSize);
        List<IsolationTree> built = new ArrayList<>(numTrees);

        Random random = new Random(seed);

        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, this.sampleSize, random);
            built.add(IsolationTree.build(sample, maxDepth, random));
        }
        this.trees = built;
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous); shorter average
     *         isolation paths give higher scores
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        // s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    /** ceil(log2(sampleSize)), with a floor of one level. */
    static int maxDepth(int sampleSize) {
        int n = Math.max(sampleSize, 2);
        return 32 - Integer.numberOfLeadingZeros(n - 1);
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        double[][] sample = new double[size][];
        // partial Fisher-Yates shuffle on indices, sampling without replacement
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return Collections.unmodifiableList(trees); }
    public int getSampleSize() { return sampleSize; }
}
