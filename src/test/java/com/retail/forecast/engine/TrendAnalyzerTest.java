package com.retail.forecast.engine;

import com.retail.forecast.model.TrendDirection;
import com.retail.forecast.model.TrendResult;
import com.retail.forecast.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendAnalyzerTest {

    private TrendAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TrendAnalyzer(TestDataFactory.createProperties());
    }

    @Test
    void analyze_constantSeries_isStableWithZeroSlope() {
        TrendResult result = analyzer.analyze(
                TestDataFactory.createFlatSeries(LocalDate.of(2024, 6, 3), 14, 10));

        assertThat(result.getDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getSlope()).isCloseTo(0.0, within(1e-9));
        assertThat(result.getMannKendallS()).isZero();
        assertThat(result.getConfidence()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void analyze_risingSeries_isIncreasing() {
        double[] values = new double[30];
        for (int i = 0; i < values.length; i++) {
            values[i] = 5 + 2.0 * i;
        }

        TrendResult result = analyzer.analyze(values);

        assertThat(result.getDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.getSlope()).isCloseTo(2.0, within(1e-9));
        assertThat(result.getIntercept()).isCloseTo(5.0, within(1e-9));
        assertThat(result.getRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getPValue()).isLessThan(0.05);
        assertThat(result.getConfidence()).isGreaterThan(0.9);
    }

    @Test
    void analyze_fallingSeries_isDecreasing() {
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 - 3.0 * i;
        }

        TrendResult result = analyzer.analyze(values);

        assertThat(result.getDirection()).isEqualTo(TrendDirection.DECREASING);
        assertThat(result.getSlope()).isCloseTo(-3.0, within(1e-9));
    }

    @Test
    void analyze_alternatingSeries_isNotSignificant() {
        double[] values = {10, 12, 10, 12, 10, 12, 10, 12, 10, 12, 10, 12, 10, 12};

        TrendResult result = analyzer.analyze(values);

        assertThat(result.getDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getPValue()).isGreaterThan(0.05);
    }

    @Test
    void analyze_tooFewSamples_returnsStable() {
        TrendResult result = analyzer.analyze(new double[]{1, 5, 9});

        assertThat(result.getDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getSampleSize()).isEqualTo(3);
        assertThat(result.getPValue()).isEqualTo(1.0);
    }

    @Test
    void analyze_emptySeries_returnsStable() {
        TrendResult result = analyzer.analyze(new double[0]);

        assertThat(result.getDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getSampleSize()).isZero();
    }

    @Test
    void mannKendallS_countsPairwiseSigns() {
        assertThat(TrendAnalyzer.mannKendallS(new double[]{1, 2, 3})).isEqualTo(3);
        assertThat(TrendAnalyzer.mannKendallS(new double[]{3, 2, 1})).isEqualTo(-3);
        assertThat(TrendAnalyzer.mannKendallS(new double[]{1, 3, 2})).isEqualTo(1);
    }

    @Test
    void mannKendallPValue_zeroStatistic_isOne() {
        assertThat(TrendAnalyzer.mannKendallPValue(0, 10)).isCloseTo(1.0, within(1e-6));
    }
}
