package com.dashboard.insights.engine.isolationforest;

import com.dashboard.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    @Test
    void anomalyScore_outlierScoresHigherThanCenter() {
        double[] xs = TestDataFactory.gaussian(500, 0.0, 1.0, 1L);
        double[] ys = TestDataFactory.gaussian(500, 0.0, 1.0, 2L);
        double[][] data = new double[500][];
        for (int i = 0; i < 500; i++) data[i] = new double[]{xs[i], ys[i]};

        IsolationForest forest = IsolationForest.train(data, 100, 256, 42L);

        double center = forest.anomalyScore(new double[]{0.0, 0.0});
        double outlier = forest.anomalyScore(new double[]{8.0, -8.0});
        assertThat(outlier).isGreaterThan(center);
        assertThat(outlier).isBetween(0.0, 1.0);
        assertThat(forest.getTreeCount()).isEqualTo(100);
        assertThat(forest.getSampleSize()).isEqualTo(256);
    }

    @Test
    void train_sampleSizeCappedAtRowCount() {
        double[][] data = {{1.0}, {2.0}, {3.0}};

        IsolationForest forest = IsolationForest.train(data, 10, 256, 7L);

        assertThat(forest.getSampleSize()).isEqualTo(3);
    }

    @Test
    void train_sameSeed_sameScores() {
        double[][] data = new double[50][];
        double[] xs = TestDataFactory.gaussian(50, 0.0, 1.0, 3L);
        for (int i = 0; i < 50; i++) data[i] = new double[]{xs[i]};

        double[] first = IsolationForest.train(data, 20, 32, 9L).scoreSamples(data);
        double[] second = IsolationForest.train(data, 20, 32, 9L).scoreSamples(data);

        assertThat(second).containsExactly(first);
    }

    @Test
    void train_zeroRows_rejected() {
        assertThatThrownBy(() -> IsolationForest.train(new double[0][], 10, 8, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void averagePathLength_knownValues() {
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isCloseTo(1.0, within(1e-12));
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.24, within(0.05));
    }
}
