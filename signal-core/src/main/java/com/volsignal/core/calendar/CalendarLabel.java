package com.volsignal.core.calendar;

/**
 * Calendar regime of a trading date, in priority order.
 *
 * <ul>
 *   <li>{@link #FOMC_BLACKOUT}: within the window of a scheduled FOMC statement; no new entries</li>
 *   <li>{@link #VIXPIRATION_DISCOUNT}: around VIX expiration, outside the OpEx window; size down</li>
 *   <li>{@link #OPEX_AMPLIFIER}: around monthly equity OpEx; dealer hedging amplifies moves</li>
 *   <li>{@link #NORMAL}: none of the above</li>
 * </ul>
 */
public enum CalendarLabel {
    FOMC_BLACKOUT,
    VIXPIRATION_DISCOUNT,
    OPEX_AMPLIFIER,
    NORMAL
}
