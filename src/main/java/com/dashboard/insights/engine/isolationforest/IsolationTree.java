package com.dashboard.insights.engine.isolationforest;

import java.util.Random;

final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        // Split only on features that still vary inside this node
        int numFeatures = data[0].length;
        double[] min = new double[numFeatures];
        double[] max = new double[numFeatures];
        int[] candidates = new int[numFeatures];
        int candidateCount = 0;
        for (int f = 0; f < numFeatures; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (double[] row : data) {
                if (row[f] < min[f]) min[f] = row[f];
                if (row[f] > max[f]) max[f] = row[f];
            }
            if (min[f] < max[f]) {
                candidates[candidateCount++] = f;
            }
        }
        if (candidateCount == 0) {
            return IsolationNode.leaf(n);
        }

        int feature = candidates[random.nextInt(candidateCount)];
        double splitValue = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (double[] row : data) {
            if (row[feature] < splitValue) leftCount++;
        }
        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[feature] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        return IsolationNode.split(feature, splitValue,
                buildNode(leftData, depth + 1, maxDepth, random),
                buildNode(rightData, depth + 1, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
