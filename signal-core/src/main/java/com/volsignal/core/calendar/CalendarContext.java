package com.volsignal.core.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Calendar overlay for one date.
 *
 * <p>The three flags are independent window tests; {@code label} and
 * {@code modifier} come from the priority cascade over them. The classifier
 * reads the raw flags, so {@code vixpirationDiscount} may be true while the
 * label is {@link CalendarLabel#OPEX_AMPLIFIER}.
 */
public record CalendarContext(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("opexAmplifier") boolean opexAmplifier,
    @JsonProperty("vixpirationDiscount") boolean vixpirationDiscount,
    @JsonProperty("fomcBlackout") boolean fomcBlackout,
    @JsonProperty("modifier") double modifier,
    @JsonProperty("label") CalendarLabel label
) {
    /** VIX discount as the classifier applies it: only outside the OpEx window. */
    public boolean vixDiscountActive() {
        return vixpirationDiscount && !opexAmplifier;
    }
}
