package com.volsignal.core.risk;

import com.volsignal.core.config.SizingConfig;
import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.model.GroupFiring;

/**
 * Signal-weighted risk budgeting.
 *
 * <h3>Formula</h3>
 * <pre>
 *   baseRisk   = capital × baseRiskPct
 *   maxRisk    = capital × maxRiskPct
 *   core       = coreMultipliers[coreCount]            (1.0 if unmapped)
 *                floored at coreFloorMultiplier when coreCount &lt; 2
 *                and all four group counts sum to ≥ coreFloorMinSignals
 *   composite  = compositeMultipliers[composite]       (1.0 if unmapped or null)
 *   groupBonus = 1 + max(0, groupsFiring − 1) × groupBonusPct
 *   multiplier = core × composite × groupBonus × calendarModifier
 *   riskBudget = min(baseRisk × multiplier, maxRisk), in cents, never negative
 * </pre>
 *
 * <h3>Strength (first match)</h3>
 * <pre>
 *   EXTREME      MULTI_SIGNAL_STRONG, groups ≥ 3 or core ≥ 5
 *   VERY_STRONG  core ≥ 4, or core ≥ 3 with groups ≥ 2
 *   STRONG       core ≥ 3, or FUNDING_STRESS / WING_PANIC / VOL_ACCELERATION
 *   MODERATE     core ≥ 2 or groups ≥ 2
 *   NONE         otherwise
 * </pre>
 */
public final class RiskBudgetSizer {

    private static final double NEUTRAL = SizingConfig.NEUTRAL_MULTIPLIER;

    private final SizingConfig config;

    public RiskBudgetSizer() {
        this(SizingConfig.defaults());
    }

    public RiskBudgetSizer(SizingConfig config) {
        this.config = config != null ? config : SizingConfig.defaults();
    }

    public SizingConfig config() {
        return config;
    }

    /**
     * Sizes one prospective trade.
     *
     * @param coreCount        core ACTION signals
     * @param composite        classifier verdict, may be null
     * @param groupsFiring     groups firing (0–4)
     * @param wingCount        wing ACTION signals
     * @param fundCount        funding ACTION signals
     * @param momCount         momentum ACTION signals
     * @param capitalOverride  capital to size against; null or non-positive uses the configured capital
     * @param calendarModifier calendar overlay modifier; non-finite or negative reads as 1.0
     * @return sizing result, never null
     */
    public RiskBudgetResult computeBudget(int coreCount, CompositeSignal composite, int groupsFiring,
                                          int wingCount, int fundCount, int momCount,
                                          Double capitalOverride, double calendarModifier) {
        double capital  = resolveCapital(capitalOverride);
        double baseRisk = capital * config.baseRiskPct();
        double maxRisk  = capital * config.maxRiskPct();

        double coreMult = config.coreMultiplier(coreCount);
        int totalSignals = coreCount + wingCount + fundCount + momCount;
        if (coreCount < 2 && totalSignals >= config.coreFloorMinSignals()) {
            coreMult = Math.max(coreMult, config.coreFloorMultiplier());
        }

        double compositeMult = config.compositeMultiplier(composite);
        double groupBonus    = 1.0 + Math.max(0, groupsFiring - 1) * config.groupBonusPct();
        double calendar      = Double.isFinite(calendarModifier) && calendarModifier >= 0 ? calendarModifier : NEUTRAL;
        double multiplier    = coreMult * compositeMult * groupBonus * calendar;

        double budget = Math.min(round2(Math.min(baseRisk * multiplier, maxRisk)), maxRisk);
        budget = Math.max(0.0, budget);

        return new RiskBudgetResult(
            budget,
            round2(baseRisk),
            round4(multiplier),
            coreMult,
            compositeMult,
            round4(groupBonus),
            coreCount,
            groupsFiring,
            composite,
            strength(coreCount, composite, groupsFiring),
            capital);
    }

    /** Convenience overload taking the per-group counts of a signal mapping. */
    public RiskBudgetResult computeBudget(GroupFiring groups, CompositeSignal composite,
                                          Double capitalOverride, double calendarModifier) {
        GroupFiring g = groups != null ? groups : GroupFiring.none();
        return computeBudget(g.coreCount(), composite, g.groupsFiring(),
            g.wingCount(), g.fundCount(), g.momCount(), capitalOverride, calendarModifier);
    }

    /** Portfolio-level cap on total risk deployed in one day. */
    public double maxDailyBudget(Double capitalOverride) {
        return resolveCapital(capitalOverride) * config.maxDailyRiskPct();
    }

    /** Daily cap minus risk already deployed today, never negative. */
    public double remainingDailyBudget(Double capitalOverride, double deployedToday) {
        double deployed = Double.isFinite(deployedToday) ? Math.max(0.0, deployedToday) : 0.0;
        return Math.max(0.0, round2(maxDailyBudget(capitalOverride) - deployed));
    }

    public static SignalStrength strength(int coreCount, CompositeSignal composite, int groupsFiring) {
        if (composite == CompositeSignal.MULTI_SIGNAL_STRONG || groupsFiring >= 3 || coreCount >= 5) {
            return SignalStrength.EXTREME;
        }
        if (coreCount >= 4 || (coreCount >= 3 && groupsFiring >= 2)) {
            return SignalStrength.VERY_STRONG;
        }
        if (coreCount >= 3
                || composite == CompositeSignal.FUNDING_STRESS
                || composite == CompositeSignal.WING_PANIC
                || composite == CompositeSignal.VOL_ACCELERATION) {
            return SignalStrength.STRONG;
        }
        if (coreCount >= 2 || groupsFiring >= 2) {
            return SignalStrength.MODERATE;
        }
        return SignalStrength.NONE;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private double resolveCapital(Double override) {
        return override != null && Double.isFinite(override) && override > 0 ? override : config.accountCapital();
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
