package com.volsignal.core.classifier;

import com.volsignal.core.calendar.CalendarContext;
import com.volsignal.core.config.ClassifierConfig;
import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.model.GroupFiring;
import com.volsignal.core.model.SignalKey;
import com.volsignal.core.model.SignalRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fuses a signal mapping and a calendar context into one {@link CompositeResult}.
 *
 * <p>Gates, checked before any rule:
 * <ol>
 *   <li>fewer than {@code tier1Min} tier-1 ACTION signals → no composite</li>
 *   <li>FOMC blackout → no composite, whatever else fires</li>
 * </ol>
 *
 * <p>Daily cascade (first match wins):
 * <ol>
 *   <li>groups ≥ 3 → FEAR_BOUNCE_STRONG when vix discount and groups &lt; 4, else MULTI_SIGNAL_STRONG</li>
 *   <li>core ≥ 3 (4 under vix discount) → FEAR_BOUNCE_STRONG_OPEX in the OpEx window, else FEAR_BOUNCE_STRONG</li>
 *   <li>funding ≥ 2 and groups ≥ 2 → FUNDING_STRESS</li>
 *   <li>wing ≥ 2 and groups ≥ 2 → WING_PANIC</li>
 *   <li>momentum ≥ 2 and groups ≥ 2 → VOL_ACCELERATION</li>
 *   <li>core ≥ 2 → FEAR_BOUNCE_LONG</li>
 * </ol>
 *
 * <p>Intraday cascade:
 * <ol>
 *   <li>groups ≥ 3, or core ≥ 3 and groups ≥ 2 → DIRECTIONAL_BEARISH</li>
 *   <li>core ≥ 2 or groups ≥ 2 → DIRECTIONAL_BEARISH_WEAK</li>
 * </ol>
 *
 * <p>The raised core threshold under vix discount applies to rule 2 only.
 * Pure: no state, no logging, never throws for any signal mapping.
 */
public final class CompositeClassifier {

    private final ClassifierConfig config;
    private final List<CompositeRule> dailyRules;
    private final List<CompositeRule> intradayRules;

    public CompositeClassifier() {
        this(ClassifierConfig.defaults());
    }

    public CompositeClassifier(ClassifierConfig config) {
        this.config        = config != null ? config : ClassifierConfig.defaults();
        this.dailyRules    = List.copyOf(buildDailyRules(this.config));
        this.intradayRules = List.copyOf(buildIntradayRules(this.config));
    }

    public ClassifierConfig config() {
        return config;
    }

    public List<CompositeRule> dailyRules() {
        return dailyRules;
    }

    public List<CompositeRule> intradayRules() {
        return intradayRules;
    }

    /**
     * @param signals  signal mapping keyed by wire key; null reads as empty
     * @param calendar calendar overlay for the evaluation date; null reads as no calendar effect
     * @param intraday true for the bearish intraday interpretation
     * @return verdict with the tier-1 firing list, never null
     */
    public CompositeResult classify(Map<String, SignalRecord> signals, CalendarContext calendar, boolean intraday) {
        Map<String, SignalRecord> s = signals != null ? signals : Map.of();
        List<String> tier1 = tier1Firing(s);

        if (tier1.size() < config.tier1Min()) {
            return CompositeResult.none(tier1);
        }
        if (calendar != null && calendar.fomcBlackout()) {
            return CompositeResult.none(tier1);
        }

        CompositeRule.Facts facts = new CompositeRule.Facts(
            GroupFiring.from(s, config.coreGroupMin()),
            calendar != null && calendar.vixDiscountActive(),
            calendar != null && calendar.opexAmplifier());

        for (CompositeRule rule : intraday ? intradayRules : dailyRules) {
            if (rule.matches(facts)) {
                return new CompositeResult(rule.apply(facts), tier1, rule.id());
            }
        }
        return CompositeResult.none(tier1);
    }

    /** Wire keys of tier-1 ACTION signals, in {@link SignalKey} order. */
    public static List<String> tier1Firing(Map<String, SignalRecord> signals) {
        List<String> firing = new ArrayList<>();
        if (signals == null) return firing;
        for (SignalKey key : SignalKey.values()) {
            SignalRecord r = signals.get(key.key());
            if (r != null && r.isTier1Action()) firing.add(key.key());
        }
        return firing;
    }

    // ── cascades ───────────────────────────────────────────────────────────

    private static List<CompositeRule> buildDailyRules(ClassifierConfig c) {
        return List.of(
            new CompositeRule("multi-group",
                f -> f.groups().groupsFiring() >= c.multiGroupMin(),
                f -> f.vixDiscount() && f.groups().groupsFiring() < 4
                    ? CompositeSignal.FEAR_BOUNCE_STRONG
                    : CompositeSignal.MULTI_SIGNAL_STRONG),
            new CompositeRule("core-strong",
                f -> f.groups().coreCount() >= (f.vixDiscount() ? c.vixDiscountCompositeMin() : c.compositeMin()),
                f -> f.opexAmplifier()
                    ? CompositeSignal.FEAR_BOUNCE_STRONG_OPEX
                    : CompositeSignal.FEAR_BOUNCE_STRONG),
            CompositeRule.of("funding-stress",
                f -> f.groups().fundCount() >= c.groupSignalMin() && f.groups().groupsFiring() >= c.pairedGroupMin(),
                CompositeSignal.FUNDING_STRESS),
            CompositeRule.of("wing-panic",
                f -> f.groups().wingCount() >= c.groupSignalMin() && f.groups().groupsFiring() >= c.pairedGroupMin(),
                CompositeSignal.WING_PANIC),
            CompositeRule.of("vol-acceleration",
                f -> f.groups().momCount() >= c.groupSignalMin() && f.groups().groupsFiring() >= c.pairedGroupMin(),
                CompositeSignal.VOL_ACCELERATION),
            CompositeRule.of("core-long",
                f -> f.groups().coreCount() >= c.coreGroupMin(),
                CompositeSignal.FEAR_BOUNCE_LONG));
    }

    private static List<CompositeRule> buildIntradayRules(ClassifierConfig c) {
        return List.of(
            CompositeRule.of("bearish",
                f -> f.groups().groupsFiring() >= c.multiGroupMin()
                    || (f.groups().coreCount() >= c.compositeMin() && f.groups().groupsFiring() >= c.pairedGroupMin()),
                CompositeSignal.DIRECTIONAL_BEARISH),
            CompositeRule.of("bearish-weak",
                f -> f.groups().coreCount() >= c.coreGroupMin() || f.groups().groupsFiring() >= c.pairedGroupMin(),
                CompositeSignal.DIRECTIONAL_BEARISH_WEAK));
    }
}
