package com.volsignal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Per-group ACTION counts of a signal mapping and the number of groups firing.
 *
 * <p>A group fires when its count reaches its minimum: 2 for core, 1 for wing,
 * funding and momentum.
 */
public record GroupFiring(
    @JsonProperty("coreCount") int coreCount,
    @JsonProperty("wingCount") int wingCount,
    @JsonProperty("fundCount") int fundCount,
    @JsonProperty("momCount") int momCount,
    @JsonProperty("groupsFiring") int groupsFiring
) {
    public static final int CORE_GROUP_MIN = 2;

    public static GroupFiring none() {
        return new GroupFiring(0, 0, 0, 0, 0);
    }

    public static GroupFiring of(int coreCount, int wingCount, int fundCount, int momCount) {
        return of(coreCount, wingCount, fundCount, momCount, CORE_GROUP_MIN);
    }

    public static GroupFiring of(int coreCount, int wingCount, int fundCount, int momCount,
                                 int coreGroupMin) {
        int groups = (coreCount >= coreGroupMin ? 1 : 0)
            + (wingCount >= 1 ? 1 : 0)
            + (fundCount >= 1 ? 1 : 0)
            + (momCount >= 1 ? 1 : 0);
        return new GroupFiring(coreCount, wingCount, fundCount, momCount, groups);
    }

    /** Counts ACTION-level signals per group in a mapping keyed by wire key. */
    public static GroupFiring from(Map<String, SignalRecord> signals) {
        return from(signals, CORE_GROUP_MIN);
    }

    public static GroupFiring from(Map<String, SignalRecord> signals, int coreGroupMin) {
        if (signals == null || signals.isEmpty()) {
            return none();
        }
        return of(
            actionCount(signals, SignalGroup.CORE),
            actionCount(signals, SignalGroup.WING),
            actionCount(signals, SignalGroup.FUNDING),
            actionCount(signals, SignalGroup.MOMENTUM),
            coreGroupMin);
    }

    public int totalCount() {
        return coreCount + wingCount + fundCount + momCount;
    }

    private static int actionCount(Map<String, SignalRecord> signals, SignalGroup group) {
        int n = 0;
        for (SignalKey key : SignalKey.ofGroup(group)) {
            SignalRecord r = signals.get(key.key());
            if (r != null && r.isAction()) n++;
        }
        return n;
    }
}
