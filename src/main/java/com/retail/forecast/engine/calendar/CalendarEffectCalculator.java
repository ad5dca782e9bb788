package com.retail.forecast.engine.calendar;

import com.retail.forecast.config.ForecastProperties;
import com.retail.forecast.model.CalendarCause;
import com.retail.forecast.model.CalendarEffect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.MonthDay;
import java.time.chrono.HijrahChronology;
import java.time.chrono.HijrahDate;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Computes the calendar-driven demand multipliers active on a date.
 *
 * Islamic effects are resolved from the Umm al-Qura Hijri calendar:
 * pre-Ramadan preparation, Ramadan (escalating by elapsed day) and Lebaran (first week of Shawwal).
 * When the conversion is out of range or disabled, the configured {@link IslamicCalendarTable}
 * is used instead; a year missing from the table contributes no Islamic effect.
 *
 * Secular effects: fixed-date holidays, weekends, paydays, school season and harvest season.
 * All active multipliers compose by product.
 *
 * Results depend only on the date. The one piece of shared state is the set of years already
 * warned about for failed Hijri conversion; later failures in those years log at DEBUG.
 */
@Component
public class CalendarEffectCalculator {

    private static final Logger log = LoggerFactory.getLogger(CalendarEffectCalculator.class);

    private static final int HIJRI_SHABAN = 8;
    private static final int HIJRI_RAMADAN = 9;
    private static final int HIJRI_SHAWWAL = 10;

    private final ForecastProperties.Calendar config;
    private final IslamicCalendarTable table;
    private final Map<MonthDay, ForecastProperties.FixedHoliday> fixedHolidays;
    private final Set<Integer> hijriWarnedYears = ConcurrentHashMap.newKeySet();

    public CalendarEffectCalculator(ForecastProperties properties, IslamicCalendarTable table) {
        this.config = properties.getCalendar();
        this.table = table;

        Map<MonthDay, ForecastProperties.FixedHoliday> holidays = new HashMap<>();
        for (ForecastProperties.FixedHoliday holiday : config.getFixedHolidays()) {
            holidays.put(MonthDay.parse("--" + holiday.getMonthDay()), holiday);
        }
        this.fixedHolidays = Collections.unmodifiableMap(holidays);
    }

    /**
     * All effects active on the date, Islamic first, then holidays, weekend and business cycle.
     */
    public List<CalendarEffect> effectsFor(LocalDate date) {
        List<CalendarEffect> effects = new ArrayList<>();

        islamicEffect(date).ifPresent(effects::add);

        ForecastProperties.FixedHoliday holiday = fixedHolidays.get(MonthDay.from(date));
        if (holiday != null) {
            effects.add(effect(date, CalendarCause.FIXED_HOLIDAY, holiday.getMultiplier(), holiday.getName()));
        }

        if (isWeekend(date)) {
            effects.add(effect(date, CalendarCause.WEEKEND, config.getWeekendMultiplier(), "Weekend"));
        }

        int dayOfMonth = date.getDayOfMonth();
        if (dayOfMonth <= config.getPaydayEndsOnDay() || dayOfMonth >= config.getPaydayStartsOnDay()) {
            effects.add(effect(date, CalendarCause.PAYDAY, config.getPaydayMultiplier(), "Payday period"));
        }

        if (isSchoolSeason(date)) {
            effects.add(effect(date, CalendarCause.SCHOOL_SEASON, config.getSchoolSeasonMultiplier(),
                    "School holiday season"));
        }

        if (config.getHarvestSeasonMonths().contains(date.getMonthValue())) {
            effects.add(effect(date, CalendarCause.HARVEST_SEASON, config.getHarvestSeasonMultiplier(),
                    "Harvest season"));
        }

        return effects;
    }

    /** Product of every active effect. */
    public double combinedMultiplier(LocalDate date) {
        return multiplierOf(date, cause -> true);
    }

    public double islamicMultiplier(LocalDate date) {
        return multiplierOf(date, CalendarCause::isIslamic);
    }

    public double businessCycleMultiplier(LocalDate date) {
        return multiplierOf(date, CalendarCause::isBusinessCycle);
    }

    public double weekendHolidayMultiplier(LocalDate date) {
        return multiplierOf(date, CalendarCause::isWeekendOrHoliday);
    }

    public boolean isRamadan(LocalDate date) {
        return resolveIslamicPosition(date).phase() == IslamicPhase.RAMADAN;
    }

    public boolean isLebaran(LocalDate date) {
        return resolveIslamicPosition(date).phase() == IslamicPhase.LEBARAN;
    }

    public boolean isFixedHoliday(LocalDate date) {
        return fixedHolidays.containsKey(MonthDay.from(date));
    }

    public Optional<String> holidayName(LocalDate date) {
        return Optional.ofNullable(fixedHolidays.get(MonthDay.from(date)))
                .map(ForecastProperties.FixedHoliday::getName);
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    private double multiplierOf(LocalDate date, Predicate<CalendarCause> filter) {
        double multiplier = 1.0;
        for (CalendarEffect effect : effectsFor(date)) {
            if (filter.test(effect.getCause())) {
                multiplier *= effect.getMultiplier();
            }
        }
        return multiplier;
    }

    private boolean isSchoolSeason(LocalDate date) {
        if (config.getSchoolSeasonMonths().contains(date.getMonthValue())) {
            return true;
        }
        return date.getMonth() == Month.DECEMBER && date.getDayOfMonth() >= config.getYearEndBreakStartDay();
    }

    private Optional<CalendarEffect> islamicEffect(LocalDate date) {
        IslamicPosition position = resolveIslamicPosition(date);
        int day = position.day();
        switch (position.phase()) {
            case PRE_RAMADAN:
                return Optional.of(effect(date, CalendarCause.PRE_RAMADAN, config.getPreRamadanMultiplier(),
                        "Ramadan preparation, " + day + " day(s) before"));
            case RAMADAN:
                double ramadan;
                if (day <= 10) {
                    ramadan = config.getRamadanEarlyMultiplier();
                } else if (day <= 20) {
                    ramadan = config.getRamadanMidMultiplier();
                } else {
                    ramadan = config.getRamadanLateMultiplier();
                }
                return Optional.of(effect(date, CalendarCause.RAMADAN, ramadan, "Ramadan day " + day));
            case LEBARAN:
                double lebaran = day <= config.getLebaranPeakDays()
                        ? config.getLebaranPeakMultiplier()
                        : config.getLebaranTailMultiplier();
                return Optional.of(effect(date, CalendarCause.LEBARAN, lebaran, "Lebaran day " + day));
            default:
                return Optional.empty();
        }
    }

    private IslamicPosition resolveIslamicPosition(LocalDate date) {
        if (config.isUseHijriConversion()) {
            try {
                return fromHijri(date);
            } catch (DateTimeException e) {
                if (hijriWarnedYears.add(date.getYear())) {
                    log.warn("Hijri conversion unavailable for year {} ({}). Using calendar table version '{}'",
                            date.getYear(), e.getMessage(), table.getVersion());
                } else {
                    log.debug("Hijri conversion failed for {}, using calendar table", date);
                }
            }
        }
        return fromTable(date);
    }

    private IslamicPosition fromHijri(LocalDate date) {
        HijrahDate hijri = HijrahDate.from(date);
        int month = hijri.get(ChronoField.MONTH_OF_YEAR);
        int day = hijri.get(ChronoField.DAY_OF_MONTH);

        if (month == HIJRI_RAMADAN) {
            return new IslamicPosition(IslamicPhase.RAMADAN, day);
        }
        if (month == HIJRI_SHAWWAL && day <= config.getLebaranDays()) {
            return new IslamicPosition(IslamicPhase.LEBARAN, day);
        }
        if (month == HIJRI_SHABAN) {
            int year = hijri.get(ChronoField.YEAR);
            LocalDate ramadanStart = LocalDate.from(HijrahChronology.INSTANCE.date(year, HIJRI_RAMADAN, 1));
            long daysBefore = ChronoUnit.DAYS.between(date, ramadanStart);
            if (daysBefore >= 1 && daysBefore <= config.getPreRamadanDays()) {
                return new IslamicPosition(IslamicPhase.PRE_RAMADAN, (int) daysBefore);
            }
        }
        return IslamicPosition.NONE;
    }

    private IslamicPosition fromTable(LocalDate date) {
        Optional<IslamicWindow> current = table.containing(date);
        if (current.isPresent()) {
            IslamicWindow window = current.get();
            if (window.inRamadan(date)) {
                int day = (int) ChronoUnit.DAYS.between(window.ramadanStart(), date) + 1;
                return new IslamicPosition(IslamicPhase.RAMADAN, day);
            }
            int day = (int) ChronoUnit.DAYS.between(window.lebaranStart(), date) + 1;
            if (day <= config.getLebaranDays()) {
                return new IslamicPosition(IslamicPhase.LEBARAN, day);
            }
            return IslamicPosition.NONE;
        }

        // Preparation window may cross into the previous Gregorian year
        Optional<IslamicWindow> next = table.nextAfter(date);
        if (next.isPresent()) {
            long daysBefore = ChronoUnit.DAYS.between(date, next.get().ramadanStart());
            if (daysBefore <= config.getPreRamadanDays()) {
                return new IslamicPosition(IslamicPhase.PRE_RAMADAN, (int) daysBefore);
            }
        }

        if (!table.coversYear(date.getYear())) {
            log.debug("No Islamic calendar window for year {}; no Islamic effect applied", date.getYear());
        }
        return IslamicPosition.NONE;
    }

    private static CalendarEffect effect(LocalDate date, CalendarCause cause, double multiplier, String description) {
        return CalendarEffect.builder()
                .date(date)
                .cause(cause)
                .multiplier(Math.max(0.0, multiplier))
                .description(description)
                .build();
    }

    private enum IslamicPhase {
        NONE,
        PRE_RAMADAN,
        RAMADAN,
        LEBARAN
    }

    private record IslamicPosition(IslamicPhase phase, int day) {
        static final IslamicPosition NONE = new IslamicPosition(IslamicPhase.NONE, 0);
    }
}
