package com.volsignal.core.config;

import com.volsignal.core.exception.SignalEngineException;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Calendar overlay settings: the maintained FOMC meeting calendar, the window
 * around each event and the sizing modifier each label carries.
 */
public record CalendarConfig(
    Set<LocalDate> fomcDates,
    int fomcWindowDays,
    int vixWindowDays,
    int opexWindowDays,
    double fomcModifier,
    double vixDiscountModifier,
    double opexModifier,
    double normalModifier
) {
    /** Statement days of scheduled FOMC meetings. Extend as the Fed publishes new years. */
    public static final List<LocalDate> DEFAULT_FOMC_DATES = List.of(
        LocalDate.of(2024, 1, 31), LocalDate.of(2024, 3, 20), LocalDate.of(2024, 5, 1),
        LocalDate.of(2024, 6, 12), LocalDate.of(2024, 7, 31), LocalDate.of(2024, 9, 18),
        LocalDate.of(2024, 11, 7), LocalDate.of(2024, 12, 18),
        LocalDate.of(2025, 1, 29), LocalDate.of(2025, 3, 19), LocalDate.of(2025, 5, 7),
        LocalDate.of(2025, 6, 18), LocalDate.of(2025, 7, 30), LocalDate.of(2025, 9, 17),
        LocalDate.of(2025, 10, 29), LocalDate.of(2025, 12, 10),
        LocalDate.of(2026, 1, 28), LocalDate.of(2026, 3, 18), LocalDate.of(2026, 4, 29),
        LocalDate.of(2026, 6, 17), LocalDate.of(2026, 7, 29), LocalDate.of(2026, 9, 16),
        LocalDate.of(2026, 10, 28), LocalDate.of(2026, 12, 9)
    );

    public CalendarConfig {
        if (fomcWindowDays < 0 || vixWindowDays < 0 || opexWindowDays < 0) {
            throw new SignalEngineException("CalendarConfig", "windows must be non-negative");
        }
        if (fomcModifier < 0 || vixDiscountModifier < 0 || opexModifier < 0 || normalModifier < 0) {
            throw new SignalEngineException("CalendarConfig", "modifiers must be non-negative");
        }
        fomcDates = fomcDates == null ? Set.of() : immutableSorted(fomcDates);
    }

    public static CalendarConfig defaults() {
        return new CalendarConfig(new TreeSet<>(DEFAULT_FOMC_DATES), 1, 1, 3, 0.0, 0.7, 1.5, 1.0);
    }

    public CalendarConfig withFomcDates(Collection<LocalDate> dates) {
        return new CalendarConfig(dates == null ? Set.of() : new TreeSet<>(dates),
            fomcWindowDays, vixWindowDays, opexWindowDays,
            fomcModifier, vixDiscountModifier, opexModifier, normalModifier);
    }

    private static Set<LocalDate> immutableSorted(Set<LocalDate> dates) {
        TreeSet<LocalDate> sorted = new TreeSet<>();
        for (LocalDate d : dates) {
            if (d != null) sorted.add(d);
        }
        return Collections.unmodifiableSortedSet(sorted);
    }
}
