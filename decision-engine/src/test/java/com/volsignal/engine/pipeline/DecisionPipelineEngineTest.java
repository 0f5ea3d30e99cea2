package com.volsignal.engine.pipeline;

import com.volsignal.core.calendar.CalendarLabel;
import com.volsignal.core.calendar.CalendarOverlay;
import com.volsignal.core.classifier.CompositeClassifier;
import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.model.CreditQuad;
import com.volsignal.core.model.MarketSnapshot;
import com.volsignal.core.model.ReferenceState;
import com.volsignal.core.model.SignalLevel;
import com.volsignal.core.risk.RiskBudgetSizer;
import com.volsignal.core.signal.SignalCalculator;
import com.volsignal.core.structure.StructureBias;
import com.volsignal.core.structure.StructureSelector;
import com.volsignal.engine.dto.DecisionReport;
import com.volsignal.engine.dto.DecisionRequest;
import com.volsignal.engine.logger.DecisionFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end run of the five components wired by hand, no Spring context.
 */
class DecisionPipelineEngineTest {

    private static final LocalDate NORMAL_DAY = LocalDate.of(2026, 6, 3);
    private static final LocalDate FOMC_DAY   = LocalDate.of(2026, 6, 17);

    /** skewing, rip and an inverted curve: three core ACTION signals. */
    static MarketSnapshot fearSnapshot() {
        return MarketSnapshot.of(Map.of(
            "skewing", 0.08,
            "rip", 75.0,
            "contango", -0.01,
            "dlt25Iv30d", 0.30,
            "dlt75Iv30d", 0.27,
            "iv30d", 0.25,
            "iv10d", 0.24,
            "ivRank1m", 60.0));
    }

    private static DecisionPipelineEngine engine(Clock clock) {
        return new DecisionPipelineEngine(new SignalCalculator(), new CalendarOverlay(),
            new CompositeClassifier(), new RiskBudgetSizer(), new StructureSelector(),
            new DecisionFlowLogger(), clock);
    }

    private final DecisionPipelineEngine engine = engine(Clock.systemUTC());

    @Nested
    @DisplayName("daily evaluation")
    class Daily {

        @Test
        @DisplayName("three core signals on a normal day → FEAR_BOUNCE_STRONG sized at base risk")
        void strongFearBounce() {
            DecisionReport r = engine.evaluate(
                DecisionRequest.daily("SPY", fearSnapshot(), ReferenceState.none(), NORMAL_DAY), "t-1");

            assertEquals("SPY", r.symbol());
            assertEquals(NORMAL_DAY, r.date());
            assertEquals(19, r.signals().size());
            assertEquals(CalendarLabel.NORMAL, r.calendar().label());
            assertEquals(CompositeSignal.FEAR_BOUNCE_STRONG, r.composite().name());
            assertEquals("core-strong", r.composite().ruleId());
            assertEquals(3, r.groups().coreCount());
            assertEquals(1, r.groups().groupsFiring());
            assertEquals(5000.0, r.budget().riskBudget(), 1e-9);
            assertEquals(25000.0, r.remainingDailyBudget(), 1e-9);
            assertEquals("t-1", r.traceId());
        }

        @Test
        @DisplayName("alerts list every ACTION key in signal order")
        void alerts() {
            DecisionReport r = engine.evaluate(
                DecisionRequest.daily("SPY", fearSnapshot(), ReferenceState.none(), NORMAL_DAY), "t-2");
            assertEquals(java.util.List.of("skewing", "rip", "contango"), r.alerts());
            r.alerts().forEach(k -> assertTrue(r.signals().get(k).level().isAtLeast(SignalLevel.WARNING)));
        }

        @Test
        @DisplayName("top structure is the head of the ranking for a bullish composite")
        void topIsHead() {
            DecisionReport r = engine.evaluate(
                DecisionRequest.daily("SPY", fearSnapshot(), ReferenceState.none(), NORMAL_DAY), "t-3");
            assertEquals(10, r.structures().size());
            assertSame(r.structures().get(0), r.topStructure());
        }

        @Test
        @DisplayName("FOMC blackout suppresses the composite and zeroes the budget")
        void fomcBlackout() {
            DecisionReport r = engine.evaluate(
                DecisionRequest.daily("SPY", fearSnapshot(), ReferenceState.none(), FOMC_DAY), "t-4");
            assertEquals(CalendarLabel.FOMC_BLACKOUT, r.calendar().label());
            assertNull(r.composite().name());
            assertEquals(3, r.composite().tier1Firing().size());
            assertEquals(0.0, r.budget().riskBudget(), 1e-9);
        }

        @Test
        @DisplayName("missing date resolves to today on the injected clock")
        void dateFromClock() {
            Clock fixed = Clock.fixed(Instant.parse("2026-06-17T14:00:00Z"), ZoneId.of("America/New_York"));
            DecisionReport r = engine(fixed).evaluate(
                DecisionRequest.daily("SPY", fearSnapshot(), null, null), "t-5");
            assertEquals(FOMC_DAY, r.date());
            assertEquals(CalendarLabel.FOMC_BLACKOUT, r.calendar().label());
        }

        @Test
        @DisplayName("capital override and deployed risk flow into sizing")
        void capitalOverride() {
            DecisionRequest req = new DecisionRequest("SPY", fearSnapshot(), null, null, NORMAL_DAY,
                false, 100_000.0, null, 4_000.0);
            DecisionReport r = engine.evaluate(req, "t-6");
            assertEquals(2000.0, r.budget().riskBudget(), 1e-9);
            assertEquals(6000.0, r.remainingDailyBudget(), 1e-9);
        }

        @Test
        @DisplayName("credit quad widening adds a fourth core signal")
        void creditQuad() {
            DecisionRequest req = new DecisionRequest("SPY", fearSnapshot(), null,
                CreditQuad.of(99.0, 101.0, 100.0, 100.0), NORMAL_DAY, false, null, null, null);
            DecisionReport r = engine.evaluate(req, "t-7");
            assertEquals(SignalLevel.ACTION, r.signals().get("credit_spread").level());
            assertEquals(4, r.groups().coreCount());
            assertEquals(7500.0, r.budget().riskBudget(), 1e-9);
        }
    }

    @Nested
    @DisplayName("intraday evaluation")
    class Intraday {

        @Test
        @DisplayName("core-only fear reads as weak bearish with a bearish top structure")
        void weakBearish() {
            DecisionRequest req = new DecisionRequest("SPY", fearSnapshot(), null, null, NORMAL_DAY,
                true, null, null, null);
            DecisionReport r = engine.evaluate(req, "t-8");
            assertEquals(CompositeSignal.DIRECTIONAL_BEARISH_WEAK, r.composite().name());
            assertEquals("bearish-weak", r.composite().ruleId());
            assertEquals(StructureBias.BEARISH, r.topStructure().bias());
        }
    }
}
