package com.retail.forecast.engine;

import com.retail.forecast.engine.calendar.CalendarEffectCalculator;
import com.retail.forecast.model.DailyObservation;
import com.retail.forecast.model.DemandEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw stock movements into a gap-free daily demand series.
 * Each date in [start, end] yields exactly one observation; days without outgoing
 * movements are materialized with value 0.
 */
@Component
public class SeriesBuilder {

    private static final Logger log = LoggerFactory.getLogger(SeriesBuilder.class);

    private final CalendarEffectCalculator calendar;

    public SeriesBuilder(CalendarEffectCalculator calendar) {
        this.calendar = calendar;
    }

    /**
     * Aggregate events into a daily series. Only outgoing movements (negative deltas) count,
     * by absolute magnitude. Events outside [start, end] are ignored.
     *
     * @throws SeriesValidationException with {@link SeriesErrorType#INVALID_RANGE} if start is after end
     */
    public List<DailyObservation> build(List<DemandEvent> events, LocalDate start, LocalDate end) {
        validateRange(start, end);

        Map<LocalDate, Double> demandByDate = new HashMap<>();
        int ignored = 0;
        if (events != null) {
            for (DemandEvent event : events) {
                if (event.getDate() == null || event.getDate().isBefore(start) || event.getDate().isAfter(end)) {
                    ignored++;
                    continue;
                }
                if (event.isOutgoing()) {
                    demandByDate.merge(event.getDate(), Math.abs(event.getQuantityDelta()), Double::sum);
                }
            }
        }
        if (ignored > 0) {
            log.debug("Ignored {} event(s) outside range {}..{}", ignored, start, end);
        }

        List<DailyObservation> series = new ArrayList<>();
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            series.add(observation(date, demandByDate.getOrDefault(date, 0.0)));
        }
        return series;
    }

    /**
     * Build a series from caller-aggregated daily totals. Only date and value of each entry are read;
     * day-of-week, weekend and holiday flags are recomputed. Gaps between dates are filled with 0.
     *
     * @throws SeriesValidationException with {@link SeriesErrorType#MALFORMED_SERIES} for duplicate,
     *         out-of-order, missing or negative entries
     */
    public List<DailyObservation> fromDailyTotals(List<DailyObservation> totals) {
        List<DailyObservation> series = new ArrayList<>();
        if (totals == null || totals.isEmpty()) {
            return series;
        }

        LocalDate previous = null;
        for (DailyObservation total : totals) {
            checkEntry(total, previous);
            LocalDate date = total.getDate();
            if (previous != null) {
                for (LocalDate gap = previous.plusDays(1); gap.isBefore(date); gap = gap.plusDays(1)) {
                    series.add(observation(gap, 0.0));
                }
            }
            series.add(observation(date, total.getValue()));
            previous = date;
        }
        return series;
    }

    /**
     * Check a caller-supplied series: every entry dated, dates strictly increasing, values
     * non-negative. An empty series passes.
     *
     * @throws SeriesValidationException with {@link SeriesErrorType#MALFORMED_SERIES} on the first bad entry
     */
    public void validate(List<DailyObservation> series) {
        if (series == null) {
            throw new SeriesValidationException(SeriesErrorType.MALFORMED_SERIES, "Series is required");
        }
        LocalDate previous = null;
        for (DailyObservation observation : series) {
            checkEntry(observation, previous);
            previous = observation.getDate();
        }
    }

    private static void checkEntry(DailyObservation entry, LocalDate previous) {
        if (entry == null || entry.getDate() == null) {
            throw new SeriesValidationException(SeriesErrorType.MALFORMED_SERIES, "Daily entry without a date");
        }
        LocalDate date = entry.getDate();
        if (entry.getValue() < 0 || Double.isNaN(entry.getValue())) {
            throw new SeriesValidationException(SeriesErrorType.MALFORMED_SERIES,
                    "Negative or undefined demand " + entry.getValue() + " on " + date);
        }
        if (previous != null && !date.isAfter(previous)) {
            throw new SeriesValidationException(SeriesErrorType.MALFORMED_SERIES,
                    (date.isEqual(previous) ? "Duplicate date " : "Out-of-order date ") + date + " after " + previous);
        }
    }

    public DailyObservation observation(LocalDate date, double value) {
        return DailyObservation.builder()
                .date(date)
                .value(value)
                .dayOfWeek(date.getDayOfWeek().getValue() % 7)
                .weekend(CalendarEffectCalculator.isWeekend(date))
                .holiday(calendar.isFixedHoliday(date))
                .build();
    }

    private void validateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new SeriesValidationException(SeriesErrorType.INVALID_RANGE, "Start and end dates are required");
        }
        if (start.isAfter(end)) {
            throw new SeriesValidationException(SeriesErrorType.INVALID_RANGE,
                    "Start date " + start + " is after end date " + end);
        }
    }
}
