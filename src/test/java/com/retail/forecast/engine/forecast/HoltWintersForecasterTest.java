package com.retail.forecast.engine.forecast;

import com.retail.forecast.model.ForecastModelType;
import com.retail.forecast.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HoltWintersForecasterTest {

    private HoltWintersForecaster forecaster;

    @BeforeEach
    void setUp() {
        forecaster = new HoltWintersForecaster(TestDataFactory.createProperties());
    }

    @Test
    void forecast_constantHistory_staysFlat() {
        double[] history = new double[28];
        Arrays.fill(history, 20.0);

        double[] forecast = forecaster.forecast(history, 10);

        assertThat(forecast).hasSize(10);
        for (double value : forecast) {
            assertThat(value).isCloseTo(20.0, within(1e-9));
        }
    }

    @Test
    void forecast_collapsingDemand_neverNegative() {
        double[] history = {90, 80, 75, 60, 55, 40, 35, 30, 20, 15, 10, 5, 2, 0, 0, 0, 0, 0, 0, 0, 0};

        double[] forecast = forecaster.forecast(history, 30);

        assertThat(forecast).hasSize(30);
        for (double value : forecast) {
            assertThat(value).isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void forecast_weeklyPatternWithZeros_neverNegative() {
        double[] history = TestDataFactory.weeklyPattern(6, 0, 0, 5, 40, 0, 60, 3);

        for (double value : forecaster.forecast(history, 21)) {
            assertThat(value).isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void forecast_weeklyPattern_keepsRelativeShape() {
        double[] history = TestDataFactory.weeklyPattern(12, 10, 10, 10, 10, 10, 40, 40);

        double[] forecast = forecaster.forecast(history, 7);

        // History length is a whole number of weeks, so the horizon starts on slot 0
        assertThat(forecast[5]).isGreaterThan(forecast[0]);
        assertThat(forecast[6]).isGreaterThan(forecast[2]);
    }

    @Test
    void forecast_shorterThanSeason_usesFlatMean() {
        double[] forecast = forecaster.forecast(new double[]{4, 6, 8}, 5);

        assertThat(forecast).containsExactly(6.0, 6.0, 6.0, 6.0, 6.0);
    }

    @Test
    void forecast_emptyHistory_returnsZeros() {
        assertThat(forecaster.forecast(new double[0], 3)).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    void fit_shorterThanSeason_throws() {
        assertThatThrownBy(() -> forecaster.fit(new double[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fit_doesNotMutateHistory() {
        double[] history = TestDataFactory.weeklyPattern(3, 1, 2, 3, 4, 5, 6, 7);
        double[] copy = history.clone();

        forecaster.fit(history);

        assertThat(history).containsExactly(copy);
    }

    @Test
    void modelType_isHoltWinters() {
        assertThat(forecaster.getModelType()).isEqualTo(ForecastModelType.HOLT_WINTERS);
    }
}
