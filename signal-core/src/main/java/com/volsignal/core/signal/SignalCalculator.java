package com.volsignal.core.signal;

import com.volsignal.core.config.SignalThresholds;
import com.volsignal.core.model.CreditQuad;
import com.volsignal.core.model.MarketSnapshot;
import com.volsignal.core.model.ReferenceState;
import com.volsignal.core.model.SignalKey;
import com.volsignal.core.model.SignalLevel;
import com.volsignal.core.model.SignalRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns one vol-surface snapshot into the 19 named signal evaluations.
 *
 * <h3>Groups</h3>
 * <pre>
 *   CORE      (tier 1)  skewing, rip, skew_25d_rr, contango, credit_spread
 *   WING      (tier 1)  wing_skew_30d, wing_skew_10d
 *   FUNDING   (tier 1)  borrow_term, borrow_spread
 *   MOMENTUM  (tier 1)  iv_momentum, skewing_change, contango_change
 *   SECONDARY (tier 2–3) fbfwd30_20, rSlp30, fwd_kink, rDrv30,
 *                       model_confidence, mw_adj_30, iv10_iv30_ratio
 * </pre>
 *
 * <p>Change-based signals read the caller-owned {@link ReferenceState}; a missing
 * reference (or a reference missing the field) compares the snapshot against itself.
 * Missing snapshot fields read as {@code 0.0}. Every ratio checks its denominator.
 * Nothing in this class throws for any market input, and it holds no state.
 */
public final class SignalCalculator {

    private static final double CONTANGO_BASE_FLOOR = 0.001;
    private static final double IV_RATIO_FLOOR      = 0.01;
    private static final double NEUTRAL_FBFWD       = 1.0;

    private final SignalThresholds t;

    public SignalCalculator() {
        this(SignalThresholds.defaults());
    }

    public SignalCalculator(SignalThresholds thresholds) {
        this.t = thresholds != null ? thresholds : SignalThresholds.defaults();
    }

    public SignalThresholds thresholds() {
        return t;
    }

    /**
     * Computes all 19 signals. {@code credit_spread} is reported neutral because no
     * credit quad is supplied; use the four-argument overload to include it.
     */
    public Map<String, SignalRecord> computeSignals(String symbol, MarketSnapshot snapshot,
                                                    ReferenceState reference) {
        return computeSignals(symbol, snapshot, reference, null);
    }

    /**
     * Computes all 19 signals for {@code symbol}.
     *
     * @param symbol    underlying the snapshot belongs to; the result does not depend on it
     * @param snapshot  current summary row; null reads as empty
     * @param reference caller-owned baseline / previous-day pair; null reads as none
     * @param credit    credit-proxy closes; null or invalid yields a neutral credit signal
     * @return mapping keyed by wire key in {@link SignalKey} order; always 19 entries
     */
    public Map<String, SignalRecord> computeSignals(String symbol, MarketSnapshot snapshot,
                                                    ReferenceState reference, CreditQuad credit) {
        MarketSnapshot s    = snapshot != null ? snapshot : MarketSnapshot.empty();
        ReferenceState ref  = reference != null ? reference : ReferenceState.none();
        MarketSnapshot base = ref.baselineOr(s);
        MarketSnapshot prev = ref.previousDayOr(s);

        EnumMap<SignalKey, SignalRecord> out = new EnumMap<>(SignalKey.class);

        coreSignals(s, base, out);
        SignalRecord creditRecord = computeCreditSignal(credit).get(SignalKey.CREDIT_SPREAD.key());
        out.put(SignalKey.CREDIT_SPREAD, creditRecord != null
            ? creditRecord
            : SignalRecord.of(SignalKey.CREDIT_SPREAD, 0.0, SignalLevel.OK));
        wingSignals(s, out);
        fundingSignals(s, out);
        momentumSignals(s, prev, out);
        secondarySignals(s, base, prev, out);

        Map<String, SignalRecord> signals = new LinkedHashMap<>();
        out.forEach((k, v) -> signals.put(k.key(), v));
        return Collections.unmodifiableMap(signals);
    }

    /**
     * Credit-proxy signal: daily % change of the credit asset minus that of the
     * treasury asset. Widening credit stress shows as a negative spread.
     *
     * @return one {@code credit_spread} entry, or an empty mapping when any input is
     *         missing, non-finite or zero
     */
    public Map<String, SignalRecord> computeCreditSignal(Double primary, Double hedge,
                                                         Double primaryPrevious, Double hedgePrevious) {
        if (!usable(primary) || !usable(hedge) || !usable(primaryPrevious) || !usable(hedgePrevious)) {
            return Map.of();
        }
        double primaryChg = (primary - primaryPrevious) / primaryPrevious;
        double hedgeChg   = (hedge - hedgePrevious) / hedgePrevious;
        double credit     = primaryChg - hedgeChg;
        SignalLevel level = credit < t.creditThresh() ? SignalLevel.ACTION : SignalLevel.OK;
        return Map.of(SignalKey.CREDIT_SPREAD.key(),
            SignalRecord.of(SignalKey.CREDIT_SPREAD, round4(credit), level));
    }

    public Map<String, SignalRecord> computeCreditSignal(CreditQuad quad) {
        if (quad == null) return Map.of();
        return computeCreditSignal(quad.primary(), quad.hedge(), quad.primaryPrevious(), quad.hedgePrevious());
    }

    // ── core fear ──────────────────────────────────────────────────────────

    private void coreSignals(MarketSnapshot s, MarketSnapshot base, Map<SignalKey, SignalRecord> out) {
        double skewing = s.get("skewing");
        out.put(SignalKey.SKEWING, SignalRecord.of(SignalKey.SKEWING, round4(skewing),
            skewing > t.skewingThresh() ? SignalLevel.ACTION : SignalLevel.OK));

        double rip = s.get("rip");
        out.put(SignalKey.RIP, SignalRecord.of(SignalKey.RIP, round2(rip),
            rip > t.ripThresh() ? SignalLevel.ACTION : SignalLevel.OK));

        double d25 = s.get("dlt25Iv30d");
        double d75 = s.get("dlt75Iv30d");
        double skew     = d25 - d75;
        double baseSkew = base.get("dlt25Iv30d", d25) - base.get("dlt75Iv30d", d75);
        double skewChg  = skew - baseSkew;
        out.put(SignalKey.SKEW_25D_RR, SignalRecord.of(SignalKey.SKEW_25D_RR, round4(skew),
                Math.abs(skewChg) > t.skewChangeThresh() ? SignalLevel.ACTION : SignalLevel.OK)
            .withBaseline(round4(baseSkew))
            .withChange(round4(skewChg)));

        double ct     = s.get("contango");
        double ctBase = base.get("contango", ct);
        double ctPct  = Math.abs(ctBase) > CONTANGO_BASE_FLOOR ? (ct - ctBase) / Math.abs(ctBase) : 0.0;
        boolean collapsed = ctPct < -t.contangoDropThresh() || ct < 0;
        out.put(SignalKey.CONTANGO, SignalRecord.of(SignalKey.CONTANGO, round4(ct),
                collapsed ? SignalLevel.ACTION : SignalLevel.OK)
            .withBaseline(round4(ctBase))
            .withChange(round4(ctPct)));
    }

    // ── wing skew ──────────────────────────────────────────────────────────

    private void wingSignals(MarketSnapshot s, Map<SignalKey, SignalRecord> out) {
        double wing30 = wingSpread(s, "dlt95Iv30d", "dlt5Iv30d");
        out.put(SignalKey.WING_SKEW_30D, SignalRecord.of(SignalKey.WING_SKEW_30D, round4(wing30),
            wing30 > t.wingSkew30dThresh() ? SignalLevel.ACTION : SignalLevel.OK));

        double wing10 = wingSpread(s, "dlt95Iv10d", "dlt5Iv10d");
        out.put(SignalKey.WING_SKEW_10D, SignalRecord.of(SignalKey.WING_SKEW_10D, round4(wing10),
            wing10 > t.wingSkew10dThresh() ? SignalLevel.ACTION : SignalLevel.OK));
    }

    /** 95-delta minus 5-delta IV; 0 unless both wings are quoted. */
    private static double wingSpread(MarketSnapshot s, String putWing, String callWing) {
        double v95 = s.get(putWing);
        double v5  = s.get(callWing);
        return v95 != 0.0 && v5 != 0.0 ? v95 - v5 : 0.0;
    }

    // ── funding stress ─────────────────────────────────────────────────────

    private void fundingSignals(MarketSnapshot s, Map<SignalKey, SignalRecord> out) {
        double b30 = s.get("borrow30");
        double b2y = s.get("borrow2y");
        double term = b30 != 0.0 && b2y != 0.0 ? b30 - b2y : 0.0;
        out.put(SignalKey.BORROW_TERM, SignalRecord.of(SignalKey.BORROW_TERM, round4(term),
            term > t.borrowTermThresh() ? SignalLevel.ACTION : SignalLevel.OK));

        double spread = b30 - s.get("riskFree30");
        out.put(SignalKey.BORROW_SPREAD, SignalRecord.of(SignalKey.BORROW_SPREAD, round4(spread),
            spread > t.borrowSpreadThresh() ? SignalLevel.ACTION : SignalLevel.OK));
    }

    // ── vol momentum ───────────────────────────────────────────────────────

    private void momentumSignals(MarketSnapshot s, MarketSnapshot prev, Map<SignalKey, SignalRecord> out) {
        double iv30   = s.get("iv30d");
        double prevIv = prev.get("iv30d", iv30);
        double ivChg  = prevIv > 0 ? iv30 - prevIv : 0.0;
        out.put(SignalKey.IV_MOMENTUM, SignalRecord.of(SignalKey.IV_MOMENTUM, round4(ivChg),
                ivChg > t.ivMomentumThresh() ? SignalLevel.ACTION : SignalLevel.OK)
            .withPreviousValue(round4(prevIv)));

        double skewing     = s.get("skewing");
        double prevSkewing = prev.get("skewing", skewing);
        double skewingChg  = skewing - prevSkewing;
        out.put(SignalKey.SKEWING_CHANGE, SignalRecord.of(SignalKey.SKEWING_CHANGE, round4(skewingChg),
                skewingChg > t.skewingChangeThresh() ? SignalLevel.ACTION : SignalLevel.OK)
            .withPreviousValue(round4(prevSkewing)));

        double ct     = s.get("contango");
        double prevCt = prev.get("contango", ct);
        double ctChg  = prevCt != 0.0 ? ct - prevCt : 0.0;
        out.put(SignalKey.CONTANGO_CHANGE, SignalRecord.of(SignalKey.CONTANGO_CHANGE, round4(ctChg),
                ctChg < t.contangoChangeThresh() ? SignalLevel.ACTION : SignalLevel.OK)
            .withPreviousValue(round4(prevCt)));
    }

    // ── secondary ──────────────────────────────────────────────────────────

    private void secondarySignals(MarketSnapshot s, MarketSnapshot base, MarketSnapshot prev,
                                  Map<SignalKey, SignalRecord> out) {
        double fb = s.get("fbfwd30_20", NEUTRAL_FBFWD);
        out.put(SignalKey.FBFWD30_20, SignalRecord.of(SignalKey.FBFWD30_20, round4(fb),
            fb > t.fbfwdHigh() || fb < t.fbfwdLow() ? SignalLevel.WARNING : SignalLevel.OK));

        double rslp     = s.get("rSlp30");
        double prevRslp = prev.get("rSlp30", rslp);
        double slopeChg = rslp - prevRslp;
        out.put(SignalKey.RSLP30, SignalRecord.of(SignalKey.RSLP30, round4(rslp),
                Math.abs(slopeChg) > t.slopeChangeThresh() ? SignalLevel.WARNING : SignalLevel.OK)
            .withPreviousValue(round4(prevRslp))
            .withChange(round4(slopeChg)));

        double kink = Math.abs(s.get("fwd30_20") - s.get("fwd60_30"));
        out.put(SignalKey.FWD_KINK, SignalRecord.of(SignalKey.FWD_KINK, round4(kink),
            kink > t.fwdKinkThresh() ? SignalLevel.INFO : SignalLevel.OK));

        // realized vol derivative climbing while implied stays flat
        double iv30     = s.get("iv30d");
        double rdrv     = s.get("rDrv30");
        double prevRdrv = prev.get("rDrv30", rdrv);
        boolean ivFlat  = Math.abs(iv30 - base.get("iv30d", iv30)) < t.ivFlatThresh();
        out.put(SignalKey.RDRV30, SignalRecord.of(SignalKey.RDRV30, round4(rdrv),
                rdrv > prevRdrv + t.rdrvRiseThresh() && ivFlat ? SignalLevel.INFO : SignalLevel.OK)
            .withPreviousValue(round4(prevRdrv)));

        // 0 means the provider sent no confidence, not a dislocation
        double confidence = s.get("confidence");
        out.put(SignalKey.MODEL_CONFIDENCE, SignalRecord.of(SignalKey.MODEL_CONFIDENCE, round4(confidence),
            confidence > 0 && confidence < t.modelConfidenceThresh() ? SignalLevel.WARNING : SignalLevel.OK));

        double mwAdj = s.get("mwAdj30");
        out.put(SignalKey.MW_ADJ_30, SignalRecord.of(SignalKey.MW_ADJ_30, mwAdj,
            mwAdj > t.mwAdjThresh() ? SignalLevel.INFO : SignalLevel.OK));

        double iv10  = s.get("iv10d");
        double ratio = iv30 > IV_RATIO_FLOOR ? iv10 / iv30 : 0.0;
        out.put(SignalKey.IV10_IV30_RATIO, SignalRecord.of(SignalKey.IV10_IV30_RATIO, round4(ratio),
            ratio > t.iv10Iv30Thresh() ? SignalLevel.WARNING : SignalLevel.OK));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static boolean usable(Double v) {
        return v != null && Double.isFinite(v) && v != 0.0;
    }

    static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
