package com.volsignal.core.config;

import com.volsignal.core.exception.SignalEngineException;

/**
 * Count thresholds of the composite cascade.
 *
 * @param tier1Min                 tier-1 ACTION signals required before any composite
 * @param coreGroupMin             core ACTION count at which the core group fires
 * @param compositeMin             core ACTION count for a strong fear bounce
 * @param vixDiscountCompositeMin  same, raised during vixpiration (core rule only)
 * @param multiGroupMin            groups firing for the multi-signal verdict
 * @param pairedGroupMin           groups firing required by the single-group verdicts
 * @param groupSignalMin           ACTION count inside funding/wing/momentum for their verdicts
 */
public record ClassifierConfig(
    int tier1Min,
    int coreGroupMin,
    int compositeMin,
    int vixDiscountCompositeMin,
    int multiGroupMin,
    int pairedGroupMin,
    int groupSignalMin
) {
    public ClassifierConfig {
        if (tier1Min < 0 || coreGroupMin < 1 || compositeMin < 1 || multiGroupMin < 1
                || pairedGroupMin < 1 || groupSignalMin < 1) {
            throw new SignalEngineException("ClassifierConfig", "counts must be positive");
        }
        if (vixDiscountCompositeMin < compositeMin) {
            throw new SignalEngineException("ClassifierConfig",
                "vixDiscountCompositeMin " + vixDiscountCompositeMin + " below compositeMin " + compositeMin);
        }
    }

    public static ClassifierConfig defaults() {
        return new ClassifierConfig(2, 2, 3, 4, 3, 2, 2);
    }
}
