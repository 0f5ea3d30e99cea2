package com.volsignal.engine.controller;

import com.volsignal.core.calendar.CalendarContext;
import com.volsignal.core.calendar.CalendarOverlay;
import com.volsignal.core.risk.RiskBudgetSizer;
import com.volsignal.engine.dto.DailyBudget;
import com.volsignal.engine.dto.DecisionReport;
import com.volsignal.engine.dto.DecisionRequest;
import com.volsignal.engine.exception.InvalidDecisionRequestException;
import com.volsignal.engine.service.DecisionService;
import com.volsignal.engine.trace.TraceContextUtil;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/decision")
public class DecisionController {

    private final DecisionService decisionService;
    private final CalendarOverlay calendarOverlay;
    private final RiskBudgetSizer riskBudgetSizer;
    private final Clock clock;

    public DecisionController(DecisionService decisionService, CalendarOverlay calendarOverlay,
                              RiskBudgetSizer riskBudgetSizer, Clock clock) {
        this.decisionService = decisionService;
        this.calendarOverlay = calendarOverlay;
        this.riskBudgetSizer = riskBudgetSizer;
        this.clock           = clock;
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<DecisionReport>> evaluate(
            @RequestBody DecisionRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceIdHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceIdHeader);
        return decisionService.evaluate(request, traceId)
            .map(ResponseEntity::ok)
            .onErrorResume(InvalidDecisionRequestException.class,
                e -> Mono.just(ResponseEntity.badRequest().header("X-Trace-Id", traceId).build()))
            .onErrorResume(e -> Mono.just(ResponseEntity.internalServerError().header("X-Trace-Id", traceId).build()));
    }

    @GetMapping("/calendar")
    public ResponseEntity<CalendarContext> calendar(
            @RequestParam(value = "date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(calendarOverlay.computeOverlay(date != null ? date : LocalDate.now(clock)));
    }

    @GetMapping("/daily-budget")
    public ResponseEntity<DailyBudget> dailyBudget(
            @RequestParam(value = "capital", required = false) Double capital,
            @RequestParam(value = "deployed", defaultValue = "0") double deployed) {
        double resolvedCapital = capital != null && capital > 0 && Double.isFinite(capital)
            ? capital
            : riskBudgetSizer.config().accountCapital();
        return ResponseEntity.ok(new DailyBudget(resolvedCapital,
            riskBudgetSizer.maxDailyBudget(capital),
            deployed,
            riskBudgetSizer.remainingDailyBudget(capital, deployed)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
