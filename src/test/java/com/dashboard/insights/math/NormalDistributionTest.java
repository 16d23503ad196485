package com.dashboard.insights.math;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NormalDistributionTest {

    @Test
    void cdf_knownValues() {
        assertThat(NormalDistribution.cdf(0.0)).isCloseTo(0.5, within(1e-9));
        assertThat(NormalDistribution.cdf(1.959964)).isCloseTo(0.975, within(1e-6));
        assertThat(NormalDistribution.cdf(-1.644854)).isCloseTo(0.05, within(1e-6));
    }

    @Test
    void inverseCdf_matchesCdf() {
        assertThat(NormalDistribution.inverseCdf(0.975)).isCloseTo(1.959964, within(1e-5));
        for (double p : new double[]{0.01, 0.2, 0.5, 0.8, 0.99}) {
            assertThat(NormalDistribution.cdf(NormalDistribution.inverseCdf(p))).isCloseTo(p, within(1e-6));
        }
    }
}
