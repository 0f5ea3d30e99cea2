package com.volsignal.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceStateTest {

    private static final MarketSnapshot MORNING = MarketSnapshot.of(Map.of("iv30d", 0.20));
    private static final MarketSnapshot YESTERDAY = MarketSnapshot.of(Map.of("iv30d", 0.18));
    private static final MarketSnapshot NOW = MarketSnapshot.of(Map.of("iv30d", 0.22));

    @Test
    @DisplayName("unset references fall back to the current snapshot")
    void fallsBackToCurrent() {
        ReferenceState none = ReferenceState.none();
        assertSame(NOW, none.baselineOr(NOW));
        assertSame(NOW, none.previousDayOr(NOW));
    }

    @Test
    @DisplayName("lifecycle calls return new instances and keep the other half")
    void lifecycle() {
        ReferenceState session = ReferenceState.none().setBaseline(MORNING);
        ReferenceState rolled  = session.setPreviousDay(YESTERDAY);

        assertNull(ReferenceState.none().baseline());
        assertEquals(MORNING, session.baseline());
        assertNull(session.previousDay());
        assertEquals(MORNING, rolled.baseline());
        assertEquals(YESTERDAY, rolled.previousDayOr(NOW));
    }
}
