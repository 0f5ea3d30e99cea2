package com.volsignal.engine.config;

import com.volsignal.core.calendar.CalendarOverlay;
import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.risk.RiskBudgetSizer;
import com.volsignal.core.signal.SignalCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "signal-engine.sizing.base-risk-pct=0.01",
    "signal-engine.sizing.composite-multipliers.WING_PANIC=2.0",
    "signal-engine.thresholds.rip-thresh=80.0",
    "signal-engine.calendar.fomc-dates[0]=2027-01-27"
})
class SignalEnginePropertiesTest {

    @Autowired
    private SignalEngineProperties properties;

    @Autowired
    private RiskBudgetSizer riskBudgetSizer;

    @Autowired
    private SignalCalculator signalCalculator;

    @Autowired
    private CalendarOverlay calendarOverlay;

    @Test
    @DisplayName("overridden sizing keys reach the sizer, others keep their defaults")
    void sizingOverrides() {
        assertEquals(0.01, riskBudgetSizer.config().baseRiskPct(), 1e-12);
        assertEquals(0.05, riskBudgetSizer.config().maxRiskPct(), 1e-12);
        assertEquals(2.0, riskBudgetSizer.config().compositeMultiplier(CompositeSignal.WING_PANIC), 1e-12);
        assertEquals(1.5, riskBudgetSizer.config().compositeMultiplier(CompositeSignal.MULTI_SIGNAL_STRONG), 1e-12);
    }

    @Test
    @DisplayName("threshold override reaches the calculator")
    void thresholdOverride() {
        assertEquals(80.0, signalCalculator.thresholds().ripThresh(), 1e-12);
        assertEquals(0.05, signalCalculator.thresholds().skewingThresh(), 1e-12);
    }

    @Test
    @DisplayName("FOMC list binds from ISO strings and replaces the default calendar")
    void fomcDates() {
        assertEquals(1, properties.getCalendar().getFomcDates().size());
        assertTrue(calendarOverlay.isFomcBlackout(LocalDate.of(2027, 1, 27)));
        assertFalse(calendarOverlay.isFomcBlackout(LocalDate.of(2026, 1, 28)));
    }
}
