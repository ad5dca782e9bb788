package com.retail.forecast.model;

public enum CalendarCause {
    RAMADAN,
    LEBARAN,
    PRE_RAMADAN,
    FIXED_HOLIDAY,
    WEEKEND,
    PAYDAY,
    SCHOOL_SEASON,
    HARVEST_SEASON;

    public boolean isIslamic() {
        return this == RAMADAN || this == LEBARAN || this == PRE_RAMADAN;
    }

    public boolean isBusinessCycle() {
        return this == PAYDAY || this == SCHOOL_SEASON || this == HARVEST_SEASON;
    }

    public boolean isWeekendOrHoliday() {
        return this == WEEKEND || this == FIXED_HOLIDAY;
    }
}
