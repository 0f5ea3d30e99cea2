package com.volsignal.core.config;

import com.volsignal.core.exception.SignalEngineException;
import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.structure.TradeStructure;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structure-scoring thresholds and point weights.
 *
 * <p>Point weights are keyed by rule id ({@code "<structure>.<condition>"}); ids
 * absent from {@code weights} keep their value in {@link #DEFAULT_WEIGHTS}.
 * An id that is not a known rule is rejected.
 */
public record SelectorConfig(
    double highIvRank,
    double lowIvRank,
    double midIvRank,
    double pinIvCeiling,
    double steepSkew,
    double mildSkew,
    double contangoRich,
    double contangoPositive,
    double contangoFlat,
    int strongSignalMin,
    int extremeSignalMin,
    double defaultIvRank,
    String ivRankField,
    Map<String, Double> weights,
    Map<CompositeSignal, Map<TradeStructure, Double>> compositeBonuses,
    Map<TradeStructure, Double> volAccelerationLowIvBonuses
) {
    public static final Map<String, Double> DEFAULT_WEIGHTS = defaultWeights();

    public SelectorConfig {
        if (lowIvRank > highIvRank) {
            throw new SignalEngineException("SelectorConfig",
                "lowIvRank " + lowIvRank + " above highIvRank " + highIvRank);
        }
        if (strongSignalMin < 1 || extremeSignalMin < strongSignalMin) {
            throw new SignalEngineException("SelectorConfig", "invalid signal-count thresholds");
        }
        if (ivRankField == null || ivRankField.isBlank()) {
            ivRankField = "ivRank1m";
        }
        Map<String, Double> merged = new LinkedHashMap<>(DEFAULT_WEIGHTS);
        if (weights != null) {
            weights.forEach((id, w) -> {
                if (!DEFAULT_WEIGHTS.containsKey(id)) {
                    throw new SignalEngineException("SelectorConfig", "unknown scoring rule id '" + id + "'");
                }
                if (w != null) merged.put(id, w);
            });
        }
        weights = Collections.unmodifiableMap(merged);
        compositeBonuses = copyBonuses(compositeBonuses);
        volAccelerationLowIvBonuses = copyRow(volAccelerationLowIvBonuses);
    }

    public static SelectorConfig defaults() {
        return new SelectorConfig(
            50.0, 30.0, 40.0, 60.0,
            0.02, 0.01,
            0.05, 0.03, 0.02,
            4, 5,
            50.0, "ivRank1m",
            DEFAULT_WEIGHTS,
            defaultCompositeBonuses(),
            defaultVolAccelerationLowIvBonuses());
    }

    public double weight(String ruleId) {
        Double w = weights.get(ruleId);
        return w != null ? w : 0.0;
    }

    /** Bonus row for a composite, empty when none applies. */
    public Map<TradeStructure, Double> bonusesFor(CompositeSignal composite, double ivRank) {
        if (composite == null) return Map.of();
        if (composite == CompositeSignal.VOL_ACCELERATION && ivRank <= midIvRank) {
            return volAccelerationLowIvBonuses;
        }
        return compositeBonuses.getOrDefault(composite, Map.of());
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("bull-put-spread.high-iv", 3.0);
        w.put("bull-put-spread.steep-skew", 2.0);
        w.put("bull-put-spread.contango", 1.0);
        w.put("long-call.low-iv", 3.0);
        w.put("long-call.strong-signal", 2.0);
        w.put("long-call.flat-term", 1.0);
        w.put("call-debit-spread.base", 2.5);
        w.put("call-debit-spread.mid-iv", 1.5);
        w.put("call-debit-spread.moderate-skew", 1.0);
        w.put("call-ratio-spread.strong-signal", 3.0);
        w.put("call-ratio-spread.elevated-iv", 1.5);
        w.put("call-ratio-spread.skew", 0.5);
        w.put("broken-wing-butterfly.extreme-signal", 3.0);
        w.put("broken-wing-butterfly.strong-signal", 1.5);
        w.put("broken-wing-butterfly.mid-iv", 1.0);
        w.put("put-debit-spread.high-iv", 2.0);
        w.put("put-debit-spread.steep-skew", 2.0);
        w.put("put-debit-spread.inverted-term", 2.0);
        w.put("long-put.low-iv", 3.0);
        w.put("long-put.strong-signal", 2.0);
        w.put("long-put.inverted-term", 1.0);
        w.put("bear-call-spread.high-iv", 2.5);
        w.put("bear-call-spread.steep-skew", 1.5);
        w.put("bear-call-spread.inverted-term", 2.0);
        w.put("iron-butterfly.high-iv", 3.0);
        w.put("iron-butterfly.flat-skew", 1.5);
        w.put("iron-butterfly.contango", 1.0);
        w.put("short-iron-condor.elevated-iv", 2.0);
        w.put("short-iron-condor.contained-skew", 1.0);
        w.put("short-iron-condor.contango", 1.0);
        w.put("short-iron-condor.weak-signal", 1.0);
        return Collections.unmodifiableMap(w);
    }

    private static Map<CompositeSignal, Map<TradeStructure, Double>> defaultCompositeBonuses() {
        Map<CompositeSignal, Map<TradeStructure, Double>> b = new EnumMap<>(CompositeSignal.class);

        // funding stress: sell the rich premium, avoid paying it
        b.put(CompositeSignal.FUNDING_STRESS, row(
            TradeStructure.BULL_PUT_SPREAD, 3.0,
            TradeStructure.BEAR_CALL_SPREAD, 2.5,
            TradeStructure.SHORT_IRON_CONDOR, 2.0,
            TradeStructure.IRON_BUTTERFLY, 1.5,
            TradeStructure.LONG_CALL, -1.0,
            TradeStructure.LONG_PUT, -1.0));

        // put-wing panic: the call wing is cheap
        b.put(CompositeSignal.WING_PANIC, row(
            TradeStructure.LONG_CALL, 3.0,
            TradeStructure.CALL_DEBIT_SPREAD, 2.5,
            TradeStructure.CALL_RATIO_SPREAD, 2.0,
            TradeStructure.BULL_PUT_SPREAD, -1.5,
            TradeStructure.SHORT_IRON_CONDOR, -2.0));

        // vol momentum from an elevated base tends to revert
        b.put(CompositeSignal.VOL_ACCELERATION, row(
            TradeStructure.IRON_BUTTERFLY, 3.0,
            TradeStructure.SHORT_IRON_CONDOR, 2.5,
            TradeStructure.BULL_PUT_SPREAD, 2.0,
            TradeStructure.BEAR_CALL_SPREAD, 1.5));

        b.put(CompositeSignal.MULTI_SIGNAL_STRONG, row(
            TradeStructure.CALL_RATIO_SPREAD, 2.5,
            TradeStructure.BROKEN_WING_BUTTERFLY, 2.0,
            TradeStructure.LONG_CALL, 1.5));

        Map<TradeStructure, Double> fearBounce = row(
            TradeStructure.LONG_CALL, 1.0,
            TradeStructure.CALL_DEBIT_SPREAD, 0.5);
        b.put(CompositeSignal.FEAR_BOUNCE_STRONG, fearBounce);
        b.put(CompositeSignal.FEAR_BOUNCE_STRONG_OPEX, fearBounce);

        b.put(CompositeSignal.FEAR_BOUNCE_LONG, row(
            TradeStructure.CALL_DEBIT_SPREAD, 1.5,
            TradeStructure.BULL_PUT_SPREAD, 1.0,
            TradeStructure.CALL_RATIO_SPREAD, -1.0,
            TradeStructure.BROKEN_WING_BUTTERFLY, -1.0));
        return b;
    }

    private static Map<TradeStructure, Double> defaultVolAccelerationLowIvBonuses() {
        return row(
            TradeStructure.LONG_CALL, 2.0,
            TradeStructure.CALL_DEBIT_SPREAD, 1.5);
    }

    private static Map<TradeStructure, Double> row(Object... pairs) {
        Map<TradeStructure, Double> m = new EnumMap<>(TradeStructure.class);
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((TradeStructure) pairs[i], (Double) pairs[i + 1]);
        }
        return m;
    }

    private static Map<CompositeSignal, Map<TradeStructure, Double>> copyBonuses(
            Map<CompositeSignal, Map<TradeStructure, Double>> source) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<CompositeSignal, Map<TradeStructure, Double>> copy = new EnumMap<>(CompositeSignal.class);
        source.forEach((composite, r) -> {
            if (composite != null) copy.put(composite, copyRow(r));
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Map<TradeStructure, Double> copyRow(Map<TradeStructure, Double> source) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<TradeStructure, Double> copy = new EnumMap<>(TradeStructure.class);
        source.forEach((s, v) -> {
            if (s != null && v != null) copy.put(s, v);
        });
        return Collections.unmodifiableMap(copy);
    }
}
