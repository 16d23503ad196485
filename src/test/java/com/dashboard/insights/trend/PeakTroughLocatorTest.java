package com.dashboard.insights.trend;

import com.dashboard.insights.config.TrendConfig;
import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.model.Extremum;
import com.dashboard.insights.model.PeaksAndTroughs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PeakTroughLocatorTest {

    private PeakTroughLocator locator;

    @BeforeEach
    void setUp() {
        locator = new PeakTroughLocator(new TrendConfig());
    }

    @Test
    void locate_defaultProminenceIsShareOfRange() {
        double[] values = {10, 50, 10, 12, 11, 90, 20, 110, 10};

        PeaksAndTroughs result = locator.locate(values, null);

        assertThat(result.getMinProminence()).isCloseTo(10.0, within(1e-12));
        // the 12 bump only rises 1 above its right neighbour
        assertThat(result.getPeaks()).extracting(Extremum::index).containsExactly(1, 5, 7);
        assertThat(result.getTroughs()).extracting(Extremum::index).containsExactly(2, 6);
        assertThat(result.getPeakCount()).isEqualTo(3);
    }

    @Test
    void locate_explicitProminenceOverridesDefault() {
        double[] values = {10, 50, 10, 12, 11, 90, 20, 110, 10};

        PeaksAndTroughs result = locator.locate(values, 0.5);

        assertThat(result.getPeaks()).extracting(Extremum::index).containsExactly(1, 3, 5, 7);
    }

    @Test
    void locate_empty_throwsInsufficientData() {
        assertThatThrownBy(() -> locator.locate(new double[0], null))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void locate_negativeProminence_rejected() {
        assertThatThrownBy(() -> locator.locate(new double[]{1, 2, 1}, -1.0))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
