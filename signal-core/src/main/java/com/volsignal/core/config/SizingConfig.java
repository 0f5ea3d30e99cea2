package com.volsignal.core.config;

import com.volsignal.core.exception.SignalEngineException;
import com.volsignal.core.model.CompositeSignal;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Signal-weighted sizing settings.
 *
 * <pre>
 *   baseRisk   = capital × baseRiskPct
 *   maxRisk    = capital × maxRiskPct
 *   multiplier = core(coreCount) × composite(name) × groupBonus × calendar
 * </pre>
 *
 * Unmapped core counts and composites fall back to {@value #NEUTRAL_MULTIPLIER}.
 */
public record SizingConfig(
    double accountCapital,
    double baseRiskPct,
    double maxRiskPct,
    double maxDailyRiskPct,
    double groupBonusPct,
    double coreFloorMultiplier,
    int coreFloorMinSignals,
    Map<Integer, Double> coreMultipliers,
    Map<CompositeSignal, Double> compositeMultipliers
) {
    public static final double NEUTRAL_MULTIPLIER = 1.0;

    public SizingConfig {
        if (accountCapital <= 0) {
            throw new SignalEngineException("SizingConfig", "accountCapital must be positive");
        }
        if (baseRiskPct < 0 || maxRiskPct < 0 || maxDailyRiskPct < 0 || groupBonusPct < 0
                || coreFloorMultiplier < 0) {
            throw new SignalEngineException("SizingConfig", "percentages and multipliers must be non-negative");
        }
        if (maxRiskPct < baseRiskPct) {
            throw new SignalEngineException("SizingConfig",
                "maxRiskPct " + maxRiskPct + " below baseRiskPct " + baseRiskPct);
        }
        coreMultipliers = coreMultipliers == null
            ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(coreMultipliers));
        compositeMultipliers = compositeMultipliers == null || compositeMultipliers.isEmpty()
            ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(compositeMultipliers));
        for (Double m : coreMultipliers.values()) {
            if (m == null || m < 0) throw new SignalEngineException("SizingConfig", "negative core multiplier");
        }
        for (Double m : compositeMultipliers.values()) {
            if (m == null || m < 0) throw new SignalEngineException("SizingConfig", "negative composite multiplier");
        }
    }

    public static SizingConfig defaults() {
        Map<Integer, Double> core = Map.of(
            3, 1.0,
            4, 1.5,
            5, 2.0);
        Map<CompositeSignal, Double> composite = new EnumMap<>(CompositeSignal.class);
        composite.put(CompositeSignal.MULTI_SIGNAL_STRONG, 1.5);
        composite.put(CompositeSignal.FEAR_BOUNCE_STRONG, 1.0);
        composite.put(CompositeSignal.FEAR_BOUNCE_STRONG_OPEX, 1.3);
        composite.put(CompositeSignal.FUNDING_STRESS, 1.2);
        composite.put(CompositeSignal.WING_PANIC, 1.1);
        composite.put(CompositeSignal.VOL_ACCELERATION, 0.9);
        composite.put(CompositeSignal.FEAR_BOUNCE_LONG, 0.7);
        return new SizingConfig(250_000.0, 0.02, 0.05, 0.10, 0.15, 0.8, 3, core, composite);
    }

    public double coreMultiplier(int coreCount) {
        return coreMultipliers.getOrDefault(coreCount, NEUTRAL_MULTIPLIER);
    }

    public double compositeMultiplier(CompositeSignal composite) {
        if (composite == null) return NEUTRAL_MULTIPLIER;
        return compositeMultipliers.getOrDefault(composite, NEUTRAL_MULTIPLIER);
    }
}
