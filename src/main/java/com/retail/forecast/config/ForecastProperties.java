package com.retail.forecast.config;

import com.retail.forecast.model.ForecastModelType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    // Days forecast when a request does not specify a horizon (7, 30 and 90 are typical)
    private int horizonDays = 30;

    // Two-sided confidence level for forecast bands
    private double confidenceLevel = 0.95;

    private ForecastModelType modelType = ForecastModelType.HOLT_WINTERS;

    private Smoothing smoothing = new Smoothing();

    private Outlier outlier = new Outlier();

    private Trend trend = new Trend();

    private Decomposition decomposition = new Decomposition();

    private Seasonality seasonality = new Seasonality();

    private Backtest backtest = new Backtest();

    private Anomaly anomaly = new Anomaly();

    private Calendar calendar = new Calendar();

    private Batch batch = new Batch();

    /** Holt-Winters smoothing constants. */
    @Data
    public static class Smoothing {
        private double alpha = 0.3;   // level
        private double beta = 0.1;    // trend
        private double gamma = 0.2;   // season
        private int seasonLength = 7;
    }

    @Data
    public static class Outlier {
        // Below this many points the IQR filter passes the series through unchanged
        private int minSamples = 4;
        private double iqrMultiplier = 1.5;
    }

    @Data
    public static class Trend {
        private int minSamples = 7;
        private double significanceLevel = 0.05;
        // Per-day decay of the trend adjustment applied to future days
        private double decayRate = 0.02;
    }

    @Data
    public static class Decomposition {
        private int minSamples = 14;
        private int windowSize = 7;
        private double smoothingAlpha = 0.3;
        // Baseline reported for an empty series
        private double defaultBaseline = 10.0;
    }

    @Data
    public static class Seasonality {
        private int minSamples = 14;
        private List<Integer> candidatePeriods = new ArrayList<>(List.of(7, 14, 30));
        private double detectionThreshold = 0.3;
        private double ramadanPeakThreshold = 0.2;
        private double lebaranPeakThreshold = 0.3;
        // Sunday-first day-of-week demand factors blended into forecasts
        private List<Double> dayOfWeekFactors = new ArrayList<>(List.of(1.0, 0.8, 0.9, 1.1, 1.2, 1.3, 1.1));
    }

    @Data
    public static class Backtest {
        private int maxWindows = 5;
        private double minAccuracy = 0.1;
        // Returned when history is shorter than twice the horizon
        private double defaultAccuracy = 0.75;
        private double defaultMape = 0.25;
    }

    @Data
    public static class Anomaly {
        private int windowSize = 7;
        // 1 (least sensitive, z > 3.0) to 10 (most sensitive, z > 1.2)
        private int sensitivityLevel = 5;
        private double minDeviationPercent = 25.0;
        private double spikeDropPercent = 50.0;
        private boolean detectSpikes = true;
        private boolean detectDrops = true;
        private boolean includeSeasonalAnomalies = true;
    }

    @Data
    public static class Calendar {
        // When false the Islamic windows come from the lookup table only
        private boolean useHijriConversion = true;
        private int preRamadanDays = 14;
        private double preRamadanMultiplier = 1.1;
        private double ramadanEarlyMultiplier = 1.3;   // days 1-10
        private double ramadanMidMultiplier = 1.6;     // days 11-20
        private double ramadanLateMultiplier = 1.8;    // days 21+
        private int lebaranDays = 7;
        private int lebaranPeakDays = 2;
        private double lebaranPeakMultiplier = 2.2;
        private double lebaranTailMultiplier = 1.5;
        private double weekendMultiplier = 1.15;
        private double paydayMultiplier = 1.15;
        private int paydayStartsOnDay = 28;
        private int paydayEndsOnDay = 3;
        private double schoolSeasonMultiplier = 1.1;
        private List<Integer> schoolSeasonMonths = new ArrayList<>(List.of(7));
        // Year-end school break starts on this day of December
        private int yearEndBreakStartDay = 20;
        private double harvestSeasonMultiplier = 1.05;
        private List<Integer> harvestSeasonMonths = new ArrayList<>(List.of(3, 4));
        private List<FixedHoliday> fixedHolidays = new ArrayList<>(List.of(
                new FixedHoliday("New Year", "01-01", 0.7),
                new FixedHoliday("Independence Day", "08-17", 1.1),
                new FixedHoliday("Christmas", "12-25", 1.4)));
        // Version label of the approximate Islamic window table below
        private String tableVersion = "builtin";
        // One entry per Ramadan; a Gregorian year may hold two
        private List<IslamicWindowEntry> islamicWindows = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FixedHoliday {
        private String name;
        // MM-dd
        private String monthDay;
        private double multiplier;
    }

    /** ISO dates (yyyy-MM-dd) of one Ramadan and the Lebaran that follows it. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IslamicWindowEntry {
        private String ramadanStart;
        private String ramadanEnd;
        private String lebaranStart;
        private String lebaranEnd;
    }

    @Data
    public static class Batch {
        private int poolSize = 4;
    }
}
