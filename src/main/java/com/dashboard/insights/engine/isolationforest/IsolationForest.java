package com.dashboard.insights.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of random isolation trees. Anomalous points isolate at shallow depth, so a
 * shorter average path means a more anomalous point.
 */
public class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest
     * @param sampleSize sub-sampling size per tree, capped at the number of rows
     * @param seed       random seed for reproducibility
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on zero rows");
        }
        int effectiveSample = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(effectiveSample, 2)) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.build(subsample(data, effectiveSample, random), maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSample);
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)), between 0 (normal) and 1 (anomalous).
     */
    public double anomalyScore(double[] point) {
        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;
        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * Negated anomaly scores for each row: lower means more anomalous.
     */
    public double[] scoreSamples(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = -anomalyScore(data[i]);
        }
        return scores;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
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

    public int getTreeCount() { return trees.size(); }
    public int getSampleSize() { return sampleSize; }
}
