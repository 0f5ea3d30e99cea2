package com.volsignal.core.signal;

import com.volsignal.core.model.CreditQuad;
import com.volsignal.core.model.MarketSnapshot;
import com.volsignal.core.model.ReferenceState;
import com.volsignal.core.model.SignalGroup;
import com.volsignal.core.model.SignalKey;
import com.volsignal.core.model.SignalLevel;
import com.volsignal.core.model.SignalRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SignalCalculator}.
 * One nested block per signal group plus the shape guarantees.
 */
class SignalCalculatorTest {

    private final SignalCalculator calculator = new SignalCalculator();

    private static MarketSnapshot snap(Object... kv) {
        Map<String, Double> m = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], ((Number) kv[i + 1]).doubleValue());
        }
        return MarketSnapshot.of(m);
    }

    private Map<String, SignalRecord> compute(MarketSnapshot s) {
        return calculator.computeSignals("SPY", s, ReferenceState.none());
    }

    private Map<String, SignalRecord> compute(MarketSnapshot s, ReferenceState ref) {
        return calculator.computeSignals("SPY", s, ref);
    }

    // ── shape ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("computeSignals(): shape")
    class ShapeTests {

        @Test
        @DisplayName("empty snapshot → exactly the 19 keys, all OK")
        void emptySnapshot_all19Ok() {
            Map<String, SignalRecord> signals = compute(MarketSnapshot.empty());

            List<String> expected = Arrays.stream(SignalKey.values()).map(SignalKey::key).toList();
            assertEquals(19, signals.size());
            assertEquals(expected, List.copyOf(signals.keySet()));
            signals.values().forEach(r -> assertEquals(SignalLevel.OK, r.level(), r.key()));
        }

        @Test
        @DisplayName("null snapshot and null reference → never throws")
        void nullInputs_noThrow() {
            Map<String, SignalRecord> signals =
                assertDoesNotThrow(() -> calculator.computeSignals(null, null, null, null));
            assertEquals(19, signals.size());
        }

        @Test
        @DisplayName("tier and group of each record match its key")
        void tierAndGroupMatchKey() {
            Map<String, SignalRecord> signals = compute(MarketSnapshot.empty());
            for (SignalKey key : SignalKey.values()) {
                SignalRecord r = signals.get(key.key());
                assertEquals(key.tier(), r.tier());
                assertEquals(key.group(), r.group());
                assertEquals(key.label(), r.label());
            }
        }

        @Test
        @DisplayName("non-finite fields read as missing")
        void nonFiniteFields_readAsMissing() {
            Map<String, Double> m = new HashMap<>();
            m.put("skewing", Double.NaN);
            m.put("iv30d", Double.POSITIVE_INFINITY);
            Map<String, SignalRecord> signals = compute(MarketSnapshot.of(m));
            assertEquals(0.0, signals.get("skewing").value());
            assertEquals(SignalLevel.OK, signals.get("iv10_iv30_ratio").level());
        }

        @Test
        @DisplayName("mapping is unmodifiable")
        void unmodifiable() {
            Map<String, SignalRecord> signals = compute(MarketSnapshot.empty());
            assertThrows(UnsupportedOperationException.class, () -> signals.remove("skewing"));
        }
    }

    // ── core fear ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("core fear signals")
    class CoreTests {

        @Test
        @DisplayName("skewing above 0.05 → ACTION")
        void skewing_action() {
            assertEquals(SignalLevel.ACTION, compute(snap("skewing", 0.08)).get("skewing").level());
            assertEquals(SignalLevel.OK, compute(snap("skewing", 0.05)).get("skewing").level());
        }

        @Test
        @DisplayName("level uses the unrounded value")
        void skewing_levelBeforeRounding() {
            SignalRecord r = compute(snap("skewing", 0.05004)).get("skewing");
            assertEquals(0.05, r.value());
            assertEquals(SignalLevel.ACTION, r.level());
        }

        @Test
        @DisplayName("rip above 70 → ACTION, reported to 2 decimals")
        void rip_action() {
            SignalRecord r = compute(snap("rip", 75.456)).get("rip");
            assertEquals(75.46, r.value());
            assertEquals(SignalLevel.ACTION, r.level());
        }

        @Test
        @DisplayName("25d risk reversal moving 0.02 vs baseline → ACTION with baseline and change")
        void skewRr_changeVsBaseline() {
            MarketSnapshot base = snap("dlt25Iv30d", 0.30, "dlt75Iv30d", 0.25);
            MarketSnapshot now  = snap("dlt25Iv30d", 0.32, "dlt75Iv30d", 0.25);

            SignalRecord r = compute(now, ReferenceState.of(base, null)).get("skew_25d_rr");
            assertEquals(SignalLevel.ACTION, r.level());
            assertEquals(0.07, r.value(), 1e-9);
            assertEquals(0.05, r.baseline(), 1e-9);
            assertEquals(0.02, r.change(), 1e-9);
        }

        @Test
        @DisplayName("no baseline → risk reversal compares against itself")
        void skewRr_noBaseline_noChange() {
            SignalRecord r = compute(snap("dlt25Iv30d", 0.40, "dlt75Iv30d", 0.20)).get("skew_25d_rr");
            assertEquals(SignalLevel.OK, r.level());
            assertEquals(0.0, r.change());
        }

        @Test
        @DisplayName("contango falling 60% vs baseline → ACTION")
        void contango_collapse() {
            SignalRecord r = compute(snap("contango", 0.04), ReferenceState.of(snap("contango", 0.10), null))
                .get("contango");
            assertEquals(SignalLevel.ACTION, r.level());
            assertEquals(-0.6, r.change(), 1e-9);
        }

        @Test
        @DisplayName("contango falling 30% vs baseline → OK")
        void contango_mildDrop() {
            SignalRecord r = compute(snap("contango", 0.07), ReferenceState.of(snap("contango", 0.10), null))
                .get("contango");
            assertEquals(SignalLevel.OK, r.level());
        }

        @Test
        @DisplayName("backwardation → ACTION without a baseline")
        void contango_negative() {
            assertEquals(SignalLevel.ACTION, compute(snap("contango", -0.01)).get("contango").level());
        }

        @Test
        @DisplayName("tiny baseline contango → no percentage change")
        void contango_tinyBaseline() {
            SignalRecord r = compute(snap("contango", 0.05), ReferenceState.of(snap("contango", 0.0005), null))
                .get("contango");
            assertEquals(0.0, r.change());
            assertEquals(SignalLevel.OK, r.level());
        }
    }

    // ── credit ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("computeCreditSignal()")
    class CreditTests {

        @Test
        @DisplayName("credit falling while treasuries rise → ACTION")
        void creditStress_action() {
            Map<String, SignalRecord> m = calculator.computeCreditSignal(100.0, 100.0, 101.0, 99.0);
            assertEquals(1, m.size());
            SignalRecord r = m.get("credit_spread");
            assertEquals(SignalLevel.ACTION, r.level());
            assertEquals(-0.0200, r.value(), 1e-4);
        }

        @Test
        @DisplayName("both assets flat → OK")
        void flat_ok() {
            SignalRecord r = calculator.computeCreditSignal(80.0, 95.0, 80.0, 95.0).get("credit_spread");
            assertEquals(SignalLevel.OK, r.level());
            assertEquals(0.0, r.value());
        }

        @Test
        @DisplayName("zero previous close → empty mapping")
        void zeroPrevious_empty() {
            assertTrue(calculator.computeCreditSignal(80.0, 95.0, 0.0, 95.0).isEmpty());
            assertTrue(calculator.computeCreditSignal(80.0, 95.0, 80.0, 0.0).isEmpty());
        }

        @Test
        @DisplayName("missing or non-finite input → empty mapping")
        void missingInput_empty() {
            assertTrue(calculator.computeCreditSignal(null, 95.0, 80.0, 95.0).isEmpty());
            assertTrue(calculator.computeCreditSignal(80.0, Double.NaN, 80.0, 95.0).isEmpty());
            assertTrue(calculator.computeCreditSignal((CreditQuad) null).isEmpty());
        }

        @Test
        @DisplayName("quad passed to computeSignals replaces the neutral placeholder")
        void computeSignals_mergesCredit() {
            Map<String, SignalRecord> signals = calculator.computeSignals("SPY", MarketSnapshot.empty(),
                ReferenceState.none(), CreditQuad.of(100.0, 100.0, 101.0, 99.0));
            assertEquals(SignalLevel.ACTION, signals.get("credit_spread").level());
            assertEquals(19, signals.size());
        }

        @Test
        @DisplayName("invalid quad → credit_spread stays neutral")
        void computeSignals_invalidQuad() {
            Map<String, SignalRecord> signals = calculator.computeSignals("SPY", MarketSnapshot.empty(),
                ReferenceState.none(), CreditQuad.of(100.0, 100.0, 0.0, 99.0));
            SignalRecord r = signals.get("credit_spread");
            assertEquals(SignalLevel.OK, r.level());
            assertEquals(0.0, r.value());
        }
    }

    // ── wing / funding ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("wing skew and funding stress")
    class WingFundingTests {

        @Test
        @DisplayName("30d wing 0.25 and 10d wing 0.18 → both ACTION")
        void wings_action() {
            Map<String, SignalRecord> s = compute(snap(
                "dlt95Iv30d", 0.45, "dlt5Iv30d", 0.20,
                "dlt95Iv10d", 0.40, "dlt5Iv10d", 0.22));
            assertEquals(SignalLevel.ACTION, s.get("wing_skew_30d").level());
            assertEquals(0.25, s.get("wing_skew_30d").value(), 1e-9);
            assertEquals(SignalLevel.ACTION, s.get("wing_skew_10d").level());
        }

        @Test
        @DisplayName("one wing unquoted → 0, OK")
        void wing_oneSideMissing() {
            SignalRecord r = compute(snap("dlt95Iv30d", 0.45)).get("wing_skew_30d");
            assertEquals(0.0, r.value());
            assertEquals(SignalLevel.OK, r.level());
        }

        @Test
        @DisplayName("inverted borrow curve and borrow above risk-free → both ACTION")
        void funding_action() {
            Map<String, SignalRecord> s = compute(snap(
                "borrow30", 0.06, "borrow2y", 0.05, "riskFree30", 0.015));
            assertEquals(SignalLevel.ACTION, s.get("borrow_term").level());
            assertEquals(SignalLevel.ACTION, s.get("borrow_spread").level());
            assertEquals(0.045, s.get("borrow_spread").value(), 1e-9);
        }

        @Test
        @DisplayName("missing 2y borrow → borrow_term 0")
        void fundingTerm_missing() {
            assertEquals(0.0, compute(snap("borrow30", 0.06)).get("borrow_term").value());
        }
    }

    // ── momentum ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("vol momentum vs previous day")
    class MomentumTests {

        @Test
        @DisplayName("iv +1pt, skewing +0.03, contango −0.04 → all three ACTION")
        void allMomentum_action() {
            MarketSnapshot prev = snap("iv30d", 0.20, "skewing", 0.02, "contango", 0.08);
            MarketSnapshot now  = snap("iv30d", 0.21, "skewing", 0.05, "contango", 0.04);

            Map<String, SignalRecord> s = compute(now, ReferenceState.of(null, prev));
            assertEquals(SignalLevel.ACTION, s.get("iv_momentum").level());
            assertEquals(0.20, s.get("iv_momentum").previousValue(), 1e-9);
            assertEquals(SignalLevel.ACTION, s.get("skewing_change").level());
            assertEquals(SignalLevel.ACTION, s.get("contango_change").level());
        }

        @Test
        @DisplayName("no previous day → no change, all OK")
        void noPreviousDay() {
            Map<String, SignalRecord> s = compute(snap("iv30d", 0.40, "skewing", 0.09, "contango", 0.01));
            assertEquals(0.0, s.get("iv_momentum").value());
            assertEquals(0.0, s.get("skewing_change").value());
            assertEquals(0.0, s.get("contango_change").value());
        }

        @Test
        @DisplayName("momentum records count in the MOMENTUM group")
        void momentumGroup() {
            assertEquals(SignalGroup.MOMENTUM, compute(MarketSnapshot.empty()).get("iv_momentum").group());
        }
    }

    // ── secondary ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("secondary signals")
    class SecondaryTests {

        @Test
        @DisplayName("fbfwd outside [0.95, 1.05] → WARNING; absent → neutral 1.0")
        void fbfwd() {
            assertEquals(SignalLevel.WARNING, compute(snap("fbfwd30_20", 1.08)).get("fbfwd30_20").level());
            assertEquals(SignalLevel.WARNING, compute(snap("fbfwd30_20", 0.90)).get("fbfwd30_20").level());
            SignalRecord absent = compute(MarketSnapshot.empty()).get("fbfwd30_20");
            assertEquals(1.0, absent.value());
            assertEquals(SignalLevel.OK, absent.level());
        }

        @Test
        @DisplayName("skew slope moving 0.4 day-over-day → WARNING")
        void rSlp30_change() {
            SignalRecord r = compute(snap("rSlp30", 0.5), ReferenceState.of(null, snap("rSlp30", 0.1)))
                .get("rSlp30");
            assertEquals(SignalLevel.WARNING, r.level());
            assertEquals(0.4, r.change(), 1e-9);
        }

        @Test
        @DisplayName("forward kink 0.02 → INFO")
        void fwdKink() {
            SignalRecord r = compute(snap("fwd30_20", 0.20, "fwd60_30", 0.22)).get("fwd_kink");
            assertEquals(SignalLevel.INFO, r.level());
        }

        @Test
        @DisplayName("realized vol derivative rising with flat IV → INFO; IV moved → OK")
        void rDrv30() {
            MarketSnapshot prev = snap("rDrv30", 0.10, "iv30d", 0.20);
            MarketSnapshot base = snap("iv30d", 0.20);
            ReferenceState ref  = ReferenceState.of(base, prev);

            assertEquals(SignalLevel.INFO,
                compute(snap("rDrv30", 0.15, "iv30d", 0.201), ref).get("rDrv30").level());
            assertEquals(SignalLevel.OK,
                compute(snap("rDrv30", 0.15, "iv30d", 0.22), ref).get("rDrv30").level());
        }

        @Test
        @DisplayName("model confidence 0.95 → WARNING; absent (0) → OK")
        void modelConfidence() {
            assertEquals(SignalLevel.WARNING, compute(snap("confidence", 0.95)).get("model_confidence").level());
            assertEquals(SignalLevel.OK, compute(snap("confidence", 0.99)).get("model_confidence").level());
            assertEquals(SignalLevel.OK, compute(MarketSnapshot.empty()).get("model_confidence").level());
        }

        @Test
        @DisplayName("market width above 0.001 → INFO")
        void mwAdj() {
            assertEquals(SignalLevel.INFO, compute(snap("mwAdj30", 0.002)).get("mw_adj_30").level());
        }

        @Test
        @DisplayName("iv10/iv30 = 1.25 → WARNING; iv30 near zero → ratio 0")
        void ivRatio() {
            SignalRecord r = compute(snap("iv10d", 0.25, "iv30d", 0.20)).get("iv10_iv30_ratio");
            assertEquals(SignalLevel.WARNING, r.level());
            assertEquals(1.25, r.value(), 1e-9);

            SignalRecord guarded = compute(snap("iv10d", 0.25, "iv30d", 0.005)).get("iv10_iv30_ratio");
            assertEquals(0.0, guarded.value());
            assertEquals(SignalLevel.OK, guarded.level());
        }

        @Test
        @DisplayName("secondary signals never reach ACTION")
        void secondaryNeverAction() {
            Map<String, SignalRecord> s = compute(snap(
                "fbfwd30_20", 2.0, "rSlp30", 3.0, "fwd30_20", 0.9, "rDrv30", 1.0,
                "confidence", 0.5, "mwAdj30", 0.5, "iv10d", 0.9, "iv30d", 0.2));
            for (SignalKey key : SignalKey.ofGroup(SignalGroup.SECONDARY)) {
                assertNotEquals(SignalLevel.ACTION, s.get(key.key()).level(), key.key());
            }
        }
    }
}
