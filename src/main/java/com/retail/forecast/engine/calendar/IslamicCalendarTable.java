package com.retail.forecast.engine.calendar;

import com.retail.forecast.config.ForecastProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lookup table of approximate Ramadan/Lebaran windows, loaded from
 * {@code forecast.calendar.islamic-windows}. Used when Hijri conversion is unavailable
 * for a date or disabled. New windows are added through configuration.
 *
 * Windows are kept sorted by Ramadan start and scanned by date range, so a Gregorian year
 * may contain two of them (2030, for example).
 */
@Component
public class IslamicCalendarTable {

    private static final Logger log = LoggerFactory.getLogger(IslamicCalendarTable.class);

    private final String version;
    private final List<IslamicWindow> windows;

    public IslamicCalendarTable(ForecastProperties properties) {
        ForecastProperties.Calendar calendar = properties.getCalendar();
        this.version = calendar.getTableVersion();

        List<IslamicWindow> parsed = new ArrayList<>();
        List<ForecastProperties.IslamicWindowEntry> entries = calendar.getIslamicWindows();
        for (int i = 0; i < entries.size(); i++) {
            parsed.add(toWindow(i, entries.get(i)));
        }
        parsed.sort(Comparator.comparing(IslamicWindow::ramadanStart));

        for (int i = 1; i < parsed.size(); i++) {
            IslamicWindow previous = parsed.get(i - 1);
            IslamicWindow current = parsed.get(i);
            if (!current.ramadanStart().isAfter(previous.lebaranEnd())) {
                throw new IllegalStateException("Islamic calendar window starting " + current.ramadanStart()
                        + " overlaps the window ending " + previous.lebaranEnd());
            }
        }
        this.windows = Collections.unmodifiableList(parsed);

        log.info("Loaded Islamic calendar table version '{}' with {} window(s)", version, windows.size());
    }

    private static IslamicWindow toWindow(int index, ForecastProperties.IslamicWindowEntry entry) {
        String label = "#" + index + (entry.getRamadanStart() != null ? " (" + entry.getRamadanStart() + ")" : "");
        IslamicWindow window = new IslamicWindow(
                parse(label, "ramadan-start", entry.getRamadanStart()),
                parse(label, "ramadan-end", entry.getRamadanEnd()),
                parse(label, "lebaran-start", entry.getLebaranStart()),
                parse(label, "lebaran-end", entry.getLebaranEnd()));

        if (window.ramadanEnd().isBefore(window.ramadanStart())
                || !window.lebaranStart().isAfter(window.ramadanEnd())
                || window.lebaranEnd().isBefore(window.lebaranStart())) {
            throw new IllegalStateException("Islamic calendar window " + label
                    + " must run ramadan-start <= ramadan-end < lebaran-start <= lebaran-end");
        }
        return window;
    }

    private static LocalDate parse(String label, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing " + field + " in Islamic calendar window " + label);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "Invalid " + field + " '" + value + "' in Islamic calendar window " + label, e);
        }
    }

    /** The window whose Ramadan or Lebaran contains the date. */
    public Optional<IslamicWindow> containing(LocalDate date) {
        for (IslamicWindow window : windows) {
            if (window.inRamadan(date) || window.inLebaran(date)) {
                return Optional.of(window);
            }
        }
        return Optional.empty();
    }

    /** The first window whose Ramadan starts strictly after the date. */
    public Optional<IslamicWindow> nextAfter(LocalDate date) {
        for (IslamicWindow window : windows) {
            if (window.ramadanStart().isAfter(date)) {
                return Optional.of(window);
            }
        }
        return Optional.empty();
    }

    /** True if any window starts or ends in the given Gregorian year. */
    public boolean coversYear(int year) {
        for (IslamicWindow window : windows) {
            if (window.ramadanStart().getYear() == year || window.lebaranEnd().getYear() == year) {
                return true;
            }
        }
        return false;
    }

    public List<IslamicWindow> windows() {
        return windows;
    }

    public String getVersion() {
        return version;
    }

    public int size() {
        return windows.size();
    }
}
