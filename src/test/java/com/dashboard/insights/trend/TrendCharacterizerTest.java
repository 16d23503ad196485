package com.dashboard.insights.trend;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.model.GrowthMetrics;
import com.dashboard.insights.model.TrendDirection;
import com.dashboard.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrendCharacterizerTest {

    private TrendCharacterizer characterizer;

    @BeforeEach
    void setUp() {
        characterizer = new TrendCharacterizer(new TrendConfig());
    }

    @Test
    void direction_risingSeries_upwardWithStrongFit() {
        TrendLine line = characterizer.direction(TestDataFactory.linear(100, 10.0, 0.5));

        assertThat(line.direction()).isEqualTo(TrendDirection.UPWARD);
        assertThat(line.slope()).isCloseTo(0.5, within(1e-9));
        assertThat(line.intercept()).isCloseTo(10.0, within(1e-9));
        assertThat(line.strength()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void direction_scalingKeepsDirection_negationFlipsIt() {
        double[] noise = TestDataFactory.gaussian(200, 0.0, 5.0, 21L);
        double[] values = new double[200];
        double[] scaled = new double[200];
        double[] negated = new double[200];
        for (int i = 0; i < 200; i++) {
            values[i] = 100.0 + 0.8 * i + noise[i];
            scaled[i] = 3.0 * values[i];
            negated[i] = -values[i];
        }

        assertThat(characterizer.direction(values).direction()).isEqualTo(TrendDirection.UPWARD);
        assertThat(characterizer.direction(scaled).direction()).isEqualTo(TrendDirection.UPWARD);
        assertThat(characterizer.direction(negated).direction()).isEqualTo(TrendDirection.DOWNWARD);
        assertThat(characterizer.direction(scaled).strength())
                .isCloseTo(characterizer.direction(values).strength(), within(1e-9));
    }

    @Test
    void direction_flatSeries_stable() {
        TrendLine line = characterizer.direction(TestDataFactory.constant(30, 12.0));

        assertThat(line.direction()).isEqualTo(TrendDirection.STABLE);
        assertThat(line.strength()).isEqualTo(1.0);
    }

    @Test
    void direction_singlePoint_throwsInsufficientData() {
        assertThatThrownBy(() -> characterizer.direction(new double[]{1.0}))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void movingAverage_lastWindowMean_nullWhenShort() {
        assertThat(characterizer.movingAverage(TestDataFactory.linear(20, 1, 1))).isNull();
        // last 30 of 1..40 average to 25.5
        assertThat(characterizer.movingAverage(TestDataFactory.linear(40, 1, 1))).isCloseTo(25.5, within(1e-12));
    }

    @Test
    void growth_shortSeries_noYearOverYearOrCagr() {
        GrowthMetrics growth = characterizer.growth(new double[]{100, 110, 121});

        assertThat(growth.getMomGrowth()).isCloseTo(10.0, within(1e-9));
        assertThat(growth.getAvgGrowthRate()).isCloseTo(10.0, within(1e-9));
        assertThat(growth.getYoyGrowth()).isNull();
        assertThat(growth.getCagr()).isNull();
        assertThat(growth.getCurrentValue()).isEqualTo(121.0);
        assertThat(growth.getStartValue()).isEqualTo(100.0);
    }

    @Test
    void growth_fullYearIncreasing_positiveYoyAndCagr() {
        double[] values = TestDataFactory.linear(400, 100.0, 1.0);

        GrowthMetrics growth = characterizer.growth(values);

        // last = 499, value 365 points back = 135
        assertThat(growth.getYoyGrowth()).isCloseTo((499.0 - 135.0) / 135.0 * 100.0, within(1e-9));
        assertThat(growth.getCagr()).isPositive();
        double expectedCagr = (Math.pow(499.0 / 100.0, 365.0 / 400.0) - 1.0) * 100.0;
        assertThat(growth.getCagr()).isCloseTo(expectedCagr, within(1e-9));
    }

    @Test
    void growth_zeroBase_changesSkipped() {
        GrowthMetrics growth = characterizer.growth(new double[]{0, 10, 20});

        assertThat(growth.getMomGrowth()).isCloseTo(100.0, within(1e-9));
        assertThat(growth.getAvgGrowthRate()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void growth_nonPositiveStart_noCagr() {
        double[] values = TestDataFactory.linear(365, 0.0, 1.0);

        assertThat(characterizer.growth(values).getCagr()).isNull();
    }
}
