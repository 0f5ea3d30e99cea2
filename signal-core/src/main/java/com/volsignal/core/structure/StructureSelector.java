package com.volsignal.core.structure;

import com.volsignal.core.config.SelectorConfig;
import com.volsignal.core.model.MarketSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Ranks the {@link TradeStructure} catalog against the vol surface.
 *
 * <p>Inputs: IV rank (override, else the snapshot's {@code ivRank1m}, else 50),
 * 25-delta risk reversal {@code dlt25Iv30d − dlt75Iv30d}, {@code contango}, and
 * the signal counts of the {@link SelectionContext}.
 *
 * <h3>Conditions (default weights)</h3>
 * <pre>
 *   BULL_PUT_SPREAD        iv &gt; high +3 · skew &gt; steep +2 · contango &gt; rich +1
 *   LONG_CALL              iv &lt; low +3 · core ≥ strong +2 · contango &lt; positive +1
 *   CALL_DEBIT_SPREAD      base +2.5 · low ≤ iv ≤ high +1.5 · mild ≤ skew ≤ steep +1
 *   CALL_RATIO_SPREAD      core ≥ strong or groups ≥ 3 +3 · iv &gt; mid +1.5 · skew &gt; mild +0.5
 *   BROKEN_WING_BUTTERFLY  core ≥ extreme or (core ≥ strong and groups ≥ 3) +3, else core ≥ strong +1.5
 *                          · low &lt; iv &lt; pin +1
 *   PUT_DEBIT_SPREAD       iv &gt; high +2 · skew &gt; steep +2 · contango &lt; flat +2
 *   LONG_PUT               iv &lt; low +3 · core ≥ strong or groups ≥ 3 +2 · contango &lt; flat +1
 *   BEAR_CALL_SPREAD       iv &gt; high +2.5 · skew &gt; steep +1.5 · contango &lt; flat +2
 *   IRON_BUTTERFLY         iv &gt; high +3 · |skew| &lt; mild +1.5 · contango &gt; rich +1
 *   SHORT_IRON_CONDOR      iv &gt; mid +2 · |skew| &lt; steep +1 · contango &gt; positive +1
 *                          · core &lt; strong and groups ≤ 1 +1
 * </pre>
 * Composite bonuses from {@link SelectorConfig#bonusesFor} are added on top.
 * Output is sorted by score descending; equal scores keep catalog order.
 */
public final class StructureSelector {

    private static final int MULTI_GROUP = 3;

    private final SelectorConfig config;

    public StructureSelector() {
        this(SelectorConfig.defaults());
    }

    public StructureSelector(SelectorConfig config) {
        this.config = config != null ? config : SelectorConfig.defaults();
    }

    public SelectorConfig config() {
        return config;
    }

    /** Ranks with no composite and no group context. */
    public List<StructureScore> rank(MarketSnapshot snapshot, int coreCount, Double ivRankOverride) {
        return rank(snapshot, SelectionContext.of(coreCount, ivRankOverride));
    }

    /**
     * @return every catalog structure exactly once, best first; never null
     */
    public List<StructureScore> rank(MarketSnapshot snapshot, SelectionContext context) {
        MarketSnapshot s     = snapshot != null ? snapshot : MarketSnapshot.empty();
        SelectionContext ctx = context != null ? context : SelectionContext.of(0, null);

        double ivRank   = resolveIvRank(s, ctx.ivRank());
        double skew     = s.get("dlt25Iv30d") - s.get("dlt75Iv30d");
        double contango = s.get("contango");
        int core        = ctx.coreCount();
        int groups      = ctx.groupsFiring();

        Map<TradeStructure, Double> bonuses = config.bonusesFor(ctx.composite(), ivRank);
        String bonusLabel = ctx.composite() != null ? ctx.composite().name() : null;
        String iv  = "IV rank " + fmt0(ivRank);
        String sk  = "skew " + fmt4(skew);
        String ct  = "contango " + fmt4(contango);
        String sig = core + " core";
        String grp = groups + " groups";

        List<StructureScore> ranked = new ArrayList<>();
        for (TradeStructure structure : TradeStructure.values()) {
            Tally t = new Tally(bonuses.getOrDefault(structure, 0.0), bonusLabel);
            switch (structure) {
                case BULL_PUT_SPREAD -> {
                    t.add(ivRank > config.highIvRank(), "bull-put-spread.high-iv", iv);
                    t.add(skew > config.steepSkew(), "bull-put-spread.steep-skew", sk);
                    t.add(contango > config.contangoRich(), "bull-put-spread.contango", ct);
                }
                case LONG_CALL -> {
                    t.add(ivRank < config.lowIvRank(), "long-call.low-iv", iv);
                    t.add(core >= config.strongSignalMin(), "long-call.strong-signal", sig);
                    t.add(contango < config.contangoPositive(), "long-call.flat-term", ct);
                }
                case CALL_DEBIT_SPREAD -> {
                    t.add(true, "call-debit-spread.base", "balanced");
                    t.add(ivRank >= config.lowIvRank() && ivRank <= config.highIvRank(),
                        "call-debit-spread.mid-iv", iv);
                    t.add(skew >= config.mildSkew() && skew <= config.steepSkew(),
                        "call-debit-spread.moderate-skew", sk);
                }
                case CALL_RATIO_SPREAD -> {
                    t.add(core >= config.strongSignalMin() || groups >= MULTI_GROUP,
                        "call-ratio-spread.strong-signal", sig + " + " + grp);
                    t.add(ivRank > config.midIvRank(), "call-ratio-spread.elevated-iv", iv);
                    t.add(skew > config.mildSkew(), "call-ratio-spread.skew", sk);
                }
                case BROKEN_WING_BUTTERFLY -> {
                    boolean extreme = core >= config.extremeSignalMin()
                        || (core >= config.strongSignalMin() && groups >= MULTI_GROUP);
                    t.add(extreme, "broken-wing-butterfly.extreme-signal", sig + " + " + grp);
                    t.add(!extreme && core >= config.strongSignalMin(),
                        "broken-wing-butterfly.strong-signal", sig);
                    t.add(ivRank > config.lowIvRank() && ivRank < config.pinIvCeiling(),
                        "broken-wing-butterfly.mid-iv", iv);
                }
                case PUT_DEBIT_SPREAD -> {
                    t.add(ivRank > config.highIvRank(), "put-debit-spread.high-iv", iv);
                    t.add(skew > config.steepSkew(), "put-debit-spread.steep-skew", sk);
                    t.add(contango < config.contangoFlat(), "put-debit-spread.inverted-term", ct);
                }
                case LONG_PUT -> {
                    t.add(ivRank < config.lowIvRank(), "long-put.low-iv", iv);
                    t.add(core >= config.strongSignalMin() || groups >= MULTI_GROUP,
                        "long-put.strong-signal", sig + " + " + grp);
                    t.add(contango < config.contangoFlat(), "long-put.inverted-term", ct);
                }
                case BEAR_CALL_SPREAD -> {
                    t.add(ivRank > config.highIvRank(), "bear-call-spread.high-iv", iv);
                    t.add(skew > config.steepSkew(), "bear-call-spread.steep-skew", sk);
                    t.add(contango < config.contangoFlat(), "bear-call-spread.inverted-term", ct);
                }
                case IRON_BUTTERFLY -> {
                    t.add(ivRank > config.highIvRank(), "iron-butterfly.high-iv", iv);
                    t.add(Math.abs(skew) < config.mildSkew(), "iron-butterfly.flat-skew", sk);
                    t.add(contango > config.contangoRich(), "iron-butterfly.contango", ct);
                }
                case SHORT_IRON_CONDOR -> {
                    t.add(ivRank > config.midIvRank(), "short-iron-condor.elevated-iv", iv);
                    t.add(Math.abs(skew) < config.steepSkew(), "short-iron-condor.contained-skew", sk);
                    t.add(contango > config.contangoPositive(), "short-iron-condor.contango", ct);
                    t.add(core < config.strongSignalMin() && groups <= 1,
                        "short-iron-condor.weak-signal", "range-bound, " + sig + " + " + grp);
                }
            }
            ranked.add(new StructureScore(structure, t.score(), t.reason()));
        }

        ranked.sort(Comparator.comparingDouble(StructureScore::score).reversed());
        return List.copyOf(ranked);
    }

    /** Best structure for the given context. */
    public StructureScore selectTop(MarketSnapshot snapshot, SelectionContext context) {
        return rank(snapshot, context).get(0);
    }

    /**
     * First ranked entry of the given bias. A bearish request with no bearish entry
     * falls back to {@link TradeStructure#PUT_DEBIT_SPREAD}.
     */
    public static Optional<StructureScore> bestWithBias(List<StructureScore> ranked, StructureBias bias) {
        if (ranked != null) {
            for (StructureScore s : ranked) {
                if (s.structure().bias() == bias) return Optional.of(s);
            }
        }
        if (bias == StructureBias.BEARISH) {
            return Optional.of(new StructureScore(TradeStructure.PUT_DEBIT_SPREAD, 0.0, "bearish fallback"));
        }
        return Optional.empty();
    }

    double resolveIvRank(MarketSnapshot snapshot, Double override) {
        if (override != null && Double.isFinite(override)) return override;
        return snapshot.get(config.ivRankField(), config.defaultIvRank());
    }

    // ── scoring ────────────────────────────────────────────────────────────

    /** Running score of one structure plus the conditions that paid. */
    private final class Tally {
        private double score;
        private final StringJoiner reasons = new StringJoiner("; ");

        Tally(double bonus, String bonusLabel) {
            if (bonus != 0.0) {
                score = bonus;
                reasons.add(bonusLabel + " bonus " + signed(bonus));
            }
        }

        void add(boolean condition, String ruleId, String detail) {
            if (!condition) return;
            double w = config.weight(ruleId);
            if (w == 0.0) return;
            score += w;
            reasons.add(detail + " " + signed(w));
        }

        double score() {
            return score;
        }

        String reason() {
            return reasons.length() == 0 ? "no conditions met" : reasons.toString();
        }
    }

    private static String signed(double v) {
        return String.format(Locale.ROOT, "(%+.1f)", v);
    }

    private static String fmt0(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }

    private static String fmt4(double v) {
        return String.format(Locale.ROOT, "%.4f", v);
    }
}
