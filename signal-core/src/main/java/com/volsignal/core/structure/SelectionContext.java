package com.volsignal.core.structure;

import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.model.GroupFiring;

/**
 * Signal context the selector scores against, besides the snapshot itself.
 *
 * @param coreCount    core ACTION signals
 * @param ivRank       IV rank override (0–100); null reads it from the snapshot
 * @param composite    composite verdict, null for none
 * @param groupsFiring groups firing (0–4)
 * @param wingCount    wing ACTION signals
 * @param fundCount    funding ACTION signals
 * @param momCount     momentum ACTION signals
 */
public record SelectionContext(
    int coreCount,
    Double ivRank,
    CompositeSignal composite,
    int groupsFiring,
    int wingCount,
    int fundCount,
    int momCount
) {
    public static SelectionContext of(int coreCount, Double ivRank) {
        return new SelectionContext(coreCount, ivRank, null, 0, 0, 0, 0);
    }

    public static SelectionContext from(GroupFiring groups, CompositeSignal composite, Double ivRank) {
        GroupFiring g = groups != null ? groups : GroupFiring.none();
        return new SelectionContext(g.coreCount(), ivRank, composite,
            g.groupsFiring(), g.wingCount(), g.fundCount(), g.momCount());
    }
}
