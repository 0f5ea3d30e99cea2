package com.volsignal.engine.service;

import com.volsignal.core.calendar.CalendarOverlay;
import com.volsignal.core.classifier.CompositeClassifier;
import com.volsignal.core.model.CompositeSignal;
import com.volsignal.core.model.MarketSnapshot;
import com.volsignal.core.risk.RiskBudgetSizer;
import com.volsignal.core.signal.SignalCalculator;
import com.volsignal.core.structure.StructureSelector;
import com.volsignal.engine.dto.DecisionRequest;
import com.volsignal.engine.exception.InvalidDecisionRequestException;
import com.volsignal.engine.logger.DecisionFlowLogger;
import com.volsignal.engine.pipeline.DecisionPipelineEngine;
import com.volsignal.engine.trace.TraceContextUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionServiceTest {

    private static final LocalDate DAY = LocalDate.of(2026, 6, 3);

    private final DecisionFlowLogger flowLogger = new DecisionFlowLogger();
    private final DecisionService service = new DecisionService(
        new DecisionPipelineEngine(new SignalCalculator(), new CalendarOverlay(), new CompositeClassifier(),
            new RiskBudgetSizer(), new StructureSelector(), flowLogger, Clock.systemUTC()),
        flowLogger);

    private static MarketSnapshot snapshot() {
        return MarketSnapshot.of(Map.of("skewing", 0.08, "rip", 75.0, "contango", -0.01, "iv30d", 0.25));
    }

    @Test
    @DisplayName("valid request emits one report carrying the trace id")
    void emitsReport() {
        StepVerifier.create(service.evaluate(DecisionRequest.daily("QQQ", snapshot(), null, DAY), "trace-abc"))
            .assertNext(report -> {
                assertEquals("QQQ", report.symbol());
                assertEquals("trace-abc", report.traceId());
                assertEquals(CompositeSignal.FEAR_BOUNCE_STRONG, report.composite().name());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("blank symbol is rejected before evaluation")
    void blankSymbol() {
        StepVerifier.create(service.evaluate(DecisionRequest.daily(" ", snapshot(), null, DAY), "t"))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(InvalidDecisionRequestException.class, e);
                assertEquals("symbol is required", e.getMessage());
            })
            .verify();
    }

    @Test
    @DisplayName("missing snapshot is rejected")
    void missingSnapshot() {
        StepVerifier.create(service.evaluate(DecisionRequest.daily("SPY", null, null, DAY), "t"))
            .expectError(InvalidDecisionRequestException.class)
            .verify();
    }

    @Test
    @DisplayName("null request is rejected")
    void nullRequest() {
        assertEquals("request body is required", DecisionService.validate(null));
    }

    @Test
    @DisplayName("trace id is visible in the Reactor Context downstream")
    void traceIdInContext() {
        Mono<String> traced = service.evaluate(DecisionRequest.daily("SPY", snapshot(), null, DAY), "ctx-1")
            .flatMap(r -> Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx))));
        StepVerifier.create(TraceContextUtil.withTraceId(traced, "ctx-1"))
            .expectNext("ctx-1")
            .verifyComplete();
    }
}
