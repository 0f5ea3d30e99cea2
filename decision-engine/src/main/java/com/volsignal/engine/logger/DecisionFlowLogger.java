package com.volsignal.engine.logger;

import com.volsignal.core.calendar.CalendarContext;
import com.volsignal.core.classifier.CompositeResult;
import com.volsignal.core.model.GroupFiring;
import com.volsignal.core.model.SignalLevel;
import com.volsignal.core.model.SignalRecord;
import com.volsignal.core.risk.RiskBudgetResult;
import com.volsignal.core.structure.StructureScore;
import com.volsignal.engine.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Logs each stage of one evaluation. Side effects only: nothing here changes
 * what the pipeline computes.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}:     request accepted by the service</li>
 *   <li>{@link #SIGNALS_COMPUTED}:     19 signals evaluated</li>
 *   <li>{@link #CALENDAR_RESOLVED}:    calendar overlay for the trading date</li>
 *   <li>{@link #COMPOSITE_CLASSIFIED}: composite verdict, or none</li>
 *   <li>{@link #BUDGET_SIZED}:         risk budget computed</li>
 *   <li>{@link #STRUCTURES_RANKED}:    structure catalog ranked</li>
 *   <li>{@link #EVALUATION_COMPLETE}:  report emitted to the caller</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.REQUEST_RECEIVED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String SIGNALS_COMPUTED     = "SIGNALS_COMPUTED";
    public static final String CALENDAR_RESOLVED    = "CALENDAR_RESOLVED";
    public static final String COMPOSITE_CLASSIFIED = "COMPOSITE_CLASSIFIED";
    public static final String BUDGET_SIZED         = "BUDGET_SIZED";
    public static final String STRUCTURES_RANKED    = "STRUCTURES_RANKED";
    public static final String EVALUATION_COMPLETE  = "EVALUATION_COMPLETE";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on each {@code onNext}.
     * The trace id comes from the signal's Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logStage(String stageName, String symbol, String traceId) {
        TraceContextUtil.withMdc(traceId, symbol, () ->
            log.info("[DecisionFlow] stage={} symbol={} traceId={}", stageName, symbol, traceId)
        );
    }

    public void logSignals(String symbol, Map<String, SignalRecord> signals, String traceId) {
        long actions  = signals.values().stream().filter(r -> r.level() == SignalLevel.ACTION).count();
        long warnings = signals.values().stream().filter(r -> r.level() == SignalLevel.WARNING).count();
        TraceContextUtil.withMdc(traceId, symbol, () ->
            log.info("[DecisionFlow] stage={} symbol={} signals={} action={} warning={} traceId={}",
                SIGNALS_COMPUTED, symbol, signals.size(), actions, warnings, traceId)
        );
    }

    public void logCalendar(String symbol, CalendarContext calendar, String traceId) {
        TraceContextUtil.withMdc(traceId, symbol, () ->
            log.info("[DecisionFlow] stage={} symbol={} date={} label={} modifier={} traceId={}",
                CALENDAR_RESOLVED, symbol, calendar.date(), calendar.label(), calendar.modifier(), traceId)
        );
    }

    public void logComposite(String symbol, CompositeResult composite, GroupFiring groups,
                             boolean fomcBlackout, String traceId) {
        TraceContextUtil.withMdc(traceId, symbol, () -> {
            if (fomcBlackout && !composite.tier1Firing().isEmpty()) {
                log.info("[DecisionFlow] FOMC blackout suppressed composite. symbol={} tier1Firing={} traceId={}",
                    symbol, composite.tier1Firing(), traceId);
            }
            log.info("[DecisionFlow] stage={} symbol={} composite={} rule={} tier1={} groups={} traceId={}",
                COMPOSITE_CLASSIFIED, symbol,
                composite.hasComposite() ? composite.name() : "NONE",
                composite.ruleId(), composite.tier1Firing().size(), groups.groupsFiring(), traceId);
        });
    }

    public void logBudget(String symbol, RiskBudgetResult budget, String traceId) {
        TraceContextUtil.withMdc(traceId, symbol, () ->
            log.info("[DecisionFlow] stage={} symbol={} riskBudget={} multiplier={} strength={} traceId={}",
                BUDGET_SIZED, symbol, budget.riskBudget(), budget.multiplier(), budget.strength(), traceId)
        );
    }

    public void logStructures(String symbol, StructureScore top, String traceId) {
        TraceContextUtil.withMdc(traceId, symbol, () ->
            log.info("[DecisionFlow] stage={} symbol={} top={} score={} traceId={}",
                STRUCTURES_RANKED, symbol,
                top != null ? top.structure() : "NONE",
                top != null ? top.score() : 0.0,
                traceId)
        );
    }

    public void logRejected(String reason, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[DecisionFlow] request rejected. reason={} traceId={}", reason, traceId)
        );
    }
}
