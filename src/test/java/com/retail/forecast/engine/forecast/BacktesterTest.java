package com.retail.forecast.engine.forecast;

import com.retail.forecast.model.BacktestResult;
import com.retail.forecast.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BacktesterTest {

    @Mock private Forecaster forecaster;

    private Backtester backtester;

    @BeforeEach
    void setUp() {
        backtester = new Backtester(TestDataFactory.createProperties());
    }

    @Test
    void backtest_historyShorterThanTwoHorizons_returnsDefault() {
        BacktestResult result = backtester.backtest(new double[10], 7, forecaster);

        assertThat(result.getSamplesTested()).isZero();
        assertThat(result.getAccuracy()).isEqualTo(0.75);
        assertThat(result.getMape()).isEqualTo(0.25);
        verify(forecaster, never()).forecast(any(), anyInt());
    }

    @Test
    void backtest_emptyHistory_returnsDefault() {
        BacktestResult result = backtester.backtest(new double[0], 7, new FlatMeanForecaster());

        assertThat(result.getSamplesTested()).isZero();
        assertThat(result.getAccuracy()).isEqualTo(0.75);
    }

    @Test
    void backtest_perfectForecaster_scoresFullAccuracy() {
        double[] history = new double[60];
        Arrays.fill(history, 12.0);

        BacktestResult result = backtester.backtest(history, 7, new FlatMeanForecaster());

        assertThat(result.getWindowsTested()).isEqualTo(5);
        assertThat(result.getSamplesTested()).isEqualTo(35);
        assertThat(result.getMape()).isCloseTo(0.0, within(1e-12));
        assertThat(result.getRmse()).isCloseTo(0.0, within(1e-12));
        assertThat(result.getAccuracy()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void backtest_windowsStopWhenTrainingWouldBeShorterThanHorizon() {
        double[] history = new double[30];
        Arrays.fill(history, 5.0);
        when(forecaster.forecast(any(), anyInt())).thenReturn(new double[]{5, 5, 5, 5, 5, 5, 5, 5, 5, 5});

        BacktestResult result = backtester.backtest(history, 10, forecaster);

        // testStart 20 and 10 qualify; the third window would train on nothing
        assertThat(result.getWindowsTested()).isEqualTo(2);
        verify(forecaster, times(2)).forecast(any(), anyInt());
    }

    @Test
    void backtest_terribleForecaster_accuracyFloorsAtMinimum() {
        double[] history = new double[28];
        Arrays.fill(history, 10.0);
        double[] wild = new double[7];
        Arrays.fill(wild, 1000.0);
        when(forecaster.forecast(any(), anyInt())).thenReturn(wild);

        BacktestResult result = backtester.backtest(history, 7, forecaster);

        assertThat(result.getMape()).isCloseTo(99.0, within(1e-9));
        assertThat(result.getAccuracy()).isEqualTo(0.1);
        assertThat(result.getMae()).isCloseTo(990.0, within(1e-9));
    }

    @Test
    void backtest_zeroActuals_skippedInMape() {
        double[] history = new double[21];
        double[] guess = new double[7];
        Arrays.fill(guess, 3.0);
        when(forecaster.forecast(any(), anyInt())).thenReturn(guess);

        BacktestResult result = backtester.backtest(history, 7, forecaster);

        assertThat(result.getMape()).isZero();
        assertThat(result.getAccuracy()).isEqualTo(1.0);
        assertThat(result.getMae()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void backtest_accuracyAlwaysInUnitInterval() {
        double[] history = TestDataFactory.weeklyPattern(10, 0, 3, 50, 1, 0, 80, 2);

        HoltWintersForecaster holtWinters = new HoltWintersForecaster(TestDataFactory.createProperties());

        BacktestResult result = backtester.backtest(history, 7, holtWinters);

        assertThat(result.getAccuracy()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        assertThat(result.getSamplesTested()).isPositive();
    }
}
