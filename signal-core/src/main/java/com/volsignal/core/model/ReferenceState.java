package com.volsignal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-symbol reference pair owned by the caller.
 *
 * <p>{@code baseline} is reset once per trading session (normally to the first
 * snapshot seen), {@code previousDay} once per day. Either may be null, in which
 * case change-based signals compare the snapshot against itself and report no change.
 * The calculator only reads this value; the lifecycle calls return new instances.
 */
public record ReferenceState(
    @JsonProperty("baseline") MarketSnapshot baseline,
    @JsonProperty("previousDay") MarketSnapshot previousDay
) {
    private static final ReferenceState NONE = new ReferenceState(null, null);

    public static ReferenceState none() {
        return NONE;
    }

    public static ReferenceState of(MarketSnapshot baseline, MarketSnapshot previousDay) {
        return new ReferenceState(baseline, previousDay);
    }

    /** Session start: pins the baseline, keeps the previous day. */
    public ReferenceState setBaseline(MarketSnapshot snapshot) {
        return new ReferenceState(snapshot, previousDay);
    }

    /** Day roll: pins the previous-day snapshot, keeps the baseline. */
    public ReferenceState setPreviousDay(MarketSnapshot snapshot) {
        return new ReferenceState(baseline, snapshot);
    }

    /** Baseline, or {@code current} when none has been set yet. */
    public MarketSnapshot baselineOr(MarketSnapshot current) {
        return baseline != null ? baseline : current;
    }

    /** Previous day, or {@code current} when none has been set yet. */
    public MarketSnapshot previousDayOr(MarketSnapshot current) {
        return previousDay != null ? previousDay : current;
    }
}
