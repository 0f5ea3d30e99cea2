package com.volsignal.core.calendar;

import com.volsignal.core.config.CalendarConfig;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Pure date arithmetic mapping a trading date to a {@link CalendarContext}.
 * No market data, no clock: the caller supplies the date.
 *
 * <h3>Cascade (first match wins)</h3>
 * <pre>
 *   |d − fomc|   ≤ fomcWindow                    → FOMC_BLACKOUT         0.0
 *   |d − vixExp| ≤ vixWindow and not opex window → VIXPIRATION_DISCOUNT  0.7
 *   |d − opex|   ≤ opexWindow                    → OPEX_AMPLIFIER        1.5
 *   otherwise                                    → NORMAL                1.0
 * </pre>
 * OpEx is the 3rd Friday of the date's month, VIX expiration the 3rd Wednesday.
 * Distances are calendar days.
 */
public final class CalendarOverlay {

    private final CalendarConfig config;

    public CalendarOverlay() {
        this(CalendarConfig.defaults());
    }

    public CalendarOverlay(CalendarConfig config) {
        this.config = config != null ? config : CalendarConfig.defaults();
    }

    public CalendarConfig config() {
        return config;
    }

    /**
     * @param date trading date; null yields a {@link CalendarLabel#NORMAL} context
     * @return calendar context, never null
     */
    public CalendarContext computeOverlay(LocalDate date) {
        if (date == null) {
            return new CalendarContext(null, false, false, false, config.normalModifier(), CalendarLabel.NORMAL);
        }
        boolean opex = distance(date, monthlyOpex(date)) <= config.opexWindowDays();
        boolean vix  = distance(date, vixExpiration(date)) <= config.vixWindowDays();
        boolean fomc = isFomcBlackout(date);

        if (fomc) {
            return new CalendarContext(date, opex, vix, true, config.fomcModifier(), CalendarLabel.FOMC_BLACKOUT);
        }
        if (vix && !opex) {
            return new CalendarContext(date, false, true, false,
                config.vixDiscountModifier(), CalendarLabel.VIXPIRATION_DISCOUNT);
        }
        if (opex) {
            return new CalendarContext(date, true, vix, false, config.opexModifier(), CalendarLabel.OPEX_AMPLIFIER);
        }
        return new CalendarContext(date, false, false, false, config.normalModifier(), CalendarLabel.NORMAL);
    }

    /** 3rd Friday of {@code date}'s month. */
    public static LocalDate monthlyOpex(LocalDate date) {
        return date.with(TemporalAdjusters.dayOfWeekInMonth(3, DayOfWeek.FRIDAY));
    }

    /** 3rd Wednesday of {@code date}'s month. */
    public static LocalDate vixExpiration(LocalDate date) {
        return date.with(TemporalAdjusters.dayOfWeekInMonth(3, DayOfWeek.WEDNESDAY));
    }

    public boolean isFomcBlackout(LocalDate date) {
        if (date == null) return false;
        for (LocalDate meeting : config.fomcDates()) {
            if (distance(date, meeting) <= config.fomcWindowDays()) return true;
        }
        return false;
    }

    private static long distance(LocalDate a, LocalDate b) {
        return Math.abs(ChronoUnit.DAYS.between(a, b));
    }
}
