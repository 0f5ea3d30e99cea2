package com.volsignal.engine.config;

import com.volsignal.core.config.CalendarConfig;
import com.volsignal.core.config.ClassifierConfig;
import com.volsignal.core.config.SelectorConfig;
import com.volsignal.core.config.SignalThresholds;
import com.volsignal.core.config.SizingConfig;
import com.volsignal.core.exception.SignalEngineException;
import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.structure.TradeStructure;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Externalised configuration surface of the decision pipeline, bound from
 * {@code signal-engine.*}. Every field starts at the core default, so a key left
 * out of {@code application.yml} keeps its documented value.
 *
 * <p>Each section converts to the immutable record the core components take;
 * invalid values fail at startup with a {@code SignalEngineException}.
 */
@Data
@ConfigurationProperties(prefix = "signal-engine")
public class SignalEngineProperties {

    /** Zone used to resolve "today" when a request carries no date. */
    private String zone = "America/New_York";

    private Thresholds thresholds = new Thresholds();
    private Classifier classifier = new Classifier();
    private Calendar calendar = new Calendar();
    private Sizing sizing = new Sizing();
    private Selector selector = new Selector();

    // ── signal thresholds ──────────────────────────────────────────────────

    @Data
    public static class Thresholds {
        private static final SignalThresholds D = SignalThresholds.defaults();

        private double skewingThresh = D.skewingThresh();
        private double ripThresh = D.ripThresh();
        private double skewChangeThresh = D.skewChangeThresh();
        private double contangoDropThresh = D.contangoDropThresh();
        private double creditThresh = D.creditThresh();
        private double wingSkew30dThresh = D.wingSkew30dThresh();
        private double wingSkew10dThresh = D.wingSkew10dThresh();
        private double borrowTermThresh = D.borrowTermThresh();
        private double borrowSpreadThresh = D.borrowSpreadThresh();
        private double ivMomentumThresh = D.ivMomentumThresh();
        private double skewingChangeThresh = D.skewingChangeThresh();
        private double contangoChangeThresh = D.contangoChangeThresh();
        private double fbfwdHigh = D.fbfwdHigh();
        private double fbfwdLow = D.fbfwdLow();
        private double slopeChangeThresh = D.slopeChangeThresh();
        private double fwdKinkThresh = D.fwdKinkThresh();
        private double rdrvRiseThresh = D.rdrvRiseThresh();
        private double ivFlatThresh = D.ivFlatThresh();
        private double modelConfidenceThresh = D.modelConfidenceThresh();
        private double mwAdjThresh = D.mwAdjThresh();
        private double iv10Iv30Thresh = D.iv10Iv30Thresh();

        public SignalThresholds toConfig() {
            return new SignalThresholds(
                skewingThresh, ripThresh, skewChangeThresh, contangoDropThresh, creditThresh,
                wingSkew30dThresh, wingSkew10dThresh,
                borrowTermThresh, borrowSpreadThresh,
                ivMomentumThresh, skewingChangeThresh, contangoChangeThresh,
                fbfwdHigh, fbfwdLow, slopeChangeThresh, fwdKinkThresh, rdrvRiseThresh, ivFlatThresh,
                modelConfidenceThresh, mwAdjThresh, iv10Iv30Thresh);
        }
    }

    // ── composite classifier ───────────────────────────────────────────────

    @Data
    public static class Classifier {
        private static final ClassifierConfig D = ClassifierConfig.defaults();

        private int tier1Min = D.tier1Min();
        private int coreGroupMin = D.coreGroupMin();
        private int compositeMin = D.compositeMin();
        private int vixDiscountCompositeMin = D.vixDiscountCompositeMin();
        private int multiGroupMin = D.multiGroupMin();
        private int pairedGroupMin = D.pairedGroupMin();
        private int groupSignalMin = D.groupSignalMin();

        public ClassifierConfig toConfig() {
            return new ClassifierConfig(tier1Min, coreGroupMin, compositeMin, vixDiscountCompositeMin,
                multiGroupMin, pairedGroupMin, groupSignalMin);
        }
    }

    // ── calendar overlay ───────────────────────────────────────────────────

    @Data
    public static class Calendar {
        private static final CalendarConfig D = CalendarConfig.defaults();

        /** ISO dates, e.g. {@code 2026-01-28}. */
        private List<String> fomcDates = D.fomcDates().stream()
            .map(LocalDate::toString)
            .collect(Collectors.toCollection(ArrayList::new));
        private int fomcWindowDays = D.fomcWindowDays();
        private int vixWindowDays = D.vixWindowDays();
        private int opexWindowDays = D.opexWindowDays();
        private double fomcModifier = D.fomcModifier();
        private double vixDiscountModifier = D.vixDiscountModifier();
        private double opexModifier = D.opexModifier();
        private double normalModifier = D.normalModifier();

        public CalendarConfig toConfig() {
            TreeSet<LocalDate> dates = null;
            if (fomcDates != null) {
                dates = new TreeSet<>();
                for (String d : fomcDates) {
                    try {
                        dates.add(LocalDate.parse(d.trim()));
                    } catch (DateTimeParseException e) {
                        throw new SignalEngineException("CalendarConfig", "invalid FOMC date '" + d + "'", e);
                    }
                }
            }
            return new CalendarConfig(dates,
                fomcWindowDays, vixWindowDays, opexWindowDays,
                fomcModifier, vixDiscountModifier, opexModifier, normalModifier);
        }
    }

    // ── risk budget ────────────────────────────────────────────────────────

    @Data
    public static class Sizing {
        private static final SizingConfig D = SizingConfig.defaults();

        private double accountCapital = D.accountCapital();
        private double baseRiskPct = D.baseRiskPct();
        private double maxRiskPct = D.maxRiskPct();
        private double maxDailyRiskPct = D.maxDailyRiskPct();
        private double groupBonusPct = D.groupBonusPct();
        private double coreFloorMultiplier = D.coreFloorMultiplier();
        private int coreFloorMinSignals = D.coreFloorMinSignals();
        private Map<Integer, Double> coreMultipliers = new LinkedHashMap<>(D.coreMultipliers());
        private Map<CompositeSignal, Double> compositeMultipliers = new LinkedHashMap<>(D.compositeMultipliers());

        public SizingConfig toConfig() {
            return new SizingConfig(accountCapital, baseRiskPct, maxRiskPct, maxDailyRiskPct, groupBonusPct,
                coreFloorMultiplier, coreFloorMinSignals, coreMultipliers, compositeMultipliers);
        }
    }

    // ── structure selector ─────────────────────────────────────────────────

    @Data
    public static class Selector {
        private static final SelectorConfig D = SelectorConfig.defaults();

        private double highIvRank = D.highIvRank();
        private double lowIvRank = D.lowIvRank();
        private double midIvRank = D.midIvRank();
        private double pinIvCeiling = D.pinIvCeiling();
        private double steepSkew = D.steepSkew();
        private double mildSkew = D.mildSkew();
        private double contangoRich = D.contangoRich();
        private double contangoPositive = D.contangoPositive();
        private double contangoFlat = D.contangoFlat();
        private int strongSignalMin = D.strongSignalMin();
        private int extremeSignalMin = D.extremeSignalMin();
        private double defaultIvRank = D.defaultIvRank();
        private String ivRankField = D.ivRankField();
        /** Point weight overrides by rule id, e.g. {@code bull-put-spread.high-iv}. */
        private Map<String, Double> weights = new LinkedHashMap<>();
        private Map<CompositeSignal, Map<TradeStructure, Double>> compositeBonuses =
            new LinkedHashMap<>(D.compositeBonuses());
        private Map<TradeStructure, Double> volAccelerationLowIvBonuses =
            new LinkedHashMap<>(D.volAccelerationLowIvBonuses());

        public SelectorConfig toConfig() {
            return new SelectorConfig(highIvRank, lowIvRank, midIvRank, pinIvCeiling,
                steepSkew, mildSkew, contangoRich, contangoPositive, contangoFlat,
                strongSignalMin, extremeSignalMin, defaultIvRank, ivRankField,
                weights, compositeBonuses, volAccelerationLowIvBonuses);
        }
    }
}
