package com.retail.forecast.engine.calendar;

import java.time.LocalDate;

/**
 * Approximate dates of one Ramadan and the Lebaran (Eid al-Fitr) that follows it.
 */
public record IslamicWindow(LocalDate ramadanStart, LocalDate ramadanEnd,
                            LocalDate lebaranStart, LocalDate lebaranEnd) {

    public boolean inRamadan(LocalDate date) {
        return !date.isBefore(ramadanStart) && !date.isAfter(ramadanEnd);
    }

    public boolean inLebaran(LocalDate date) {
        return !date.isBefore(lebaranStart) && !date.isAfter(lebaranEnd);
    }
}
