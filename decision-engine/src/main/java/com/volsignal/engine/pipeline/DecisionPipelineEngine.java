package com.volsignal.engine.pipeline;

import com.volsignal.core.calendar.CalendarContext;
import com.volsignal.core.calendar.CalendarOverlay;
import com.volsignal.core.classifier.CompositeClassifier;
import com.volsignal.core.classifier.CompositeResult;
import com.volsignal.core.model.GroupFiring;
import com.volsignal.core.model.SignalLevel;
import com.volsignal.core.model.SignalRecord;
import com.volsignal.core.risk.RiskBudgetResult;
import com.volsignal.core.risk.RiskBudgetSizer;
import com.volsignal.core.signal.SignalCalculator;
import com.volsignal.core.structure.SelectionContext;
import com.volsignal.core.structure.StructureBias;
import com.volsignal.core.structure.StructureScore;
import com.volsignal.core.structure.StructureSelector;
import com.volsignal.engine.dto.DecisionReport;
import com.volsignal.engine.dto.DecisionRequest;
import com.volsignal.engine.logger.DecisionFlowLogger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Runs one request through the five core components.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>SignalCalculator: snapshot + caller reference + credit quad → 19 signals</li>
 *   <li>CalendarOverlay: trading date → calendar context</li>
 *   <li>CompositeClassifier: signals + calendar → composite and tier-1 list</li>
 *   <li>RiskBudgetSizer: group counts + composite + calendar modifier → risk budget</li>
 *   <li>StructureSelector: snapshot + group counts + composite → ranked catalog</li>
 * </ol>
 *
 * <p>A bearish composite picks the best bearish structure as the top pick; every
 * other verdict takes the head of the ranking. Synchronous and stateless.
 */
@Component
public class DecisionPipelineEngine {

    private final SignalCalculator signalCalculator;
    private final CalendarOverlay calendarOverlay;
    private final CompositeClassifier compositeClassifier;
    private final RiskBudgetSizer riskBudgetSizer;
    private final StructureSelector structureSelector;
    private final DecisionFlowLogger flowLogger;
    private final Clock clock;

    public DecisionPipelineEngine(SignalCalculator signalCalculator, CalendarOverlay calendarOverlay,
                                  CompositeClassifier compositeClassifier, RiskBudgetSizer riskBudgetSizer,
                                  StructureSelector structureSelector, DecisionFlowLogger flowLogger,
                                  Clock clock) {
        this.signalCalculator    = signalCalculator;
        this.calendarOverlay     = calendarOverlay;
        this.compositeClassifier = compositeClassifier;
        this.riskBudgetSizer     = riskBudgetSizer;
        this.structureSelector   = structureSelector;
        this.flowLogger          = flowLogger;
        this.clock               = clock;
    }

    public DecisionReport evaluate(DecisionRequest request, String traceId) {
        String symbol  = request.symbol();
        LocalDate date = request.date() != null ? request.date() : LocalDate.now(clock);

        // ── signals ────────────────────────────────────────────────────────
        Map<String, SignalRecord> signals = signalCalculator.computeSignals(
            symbol, request.snapshot(), request.reference(), request.credit());
        flowLogger.logSignals(symbol, signals, traceId);

        // ── calendar ───────────────────────────────────────────────────────
        CalendarContext calendar = calendarOverlay.computeOverlay(date);
        flowLogger.logCalendar(symbol, calendar, traceId);

        // ── composite ──────────────────────────────────────────────────────
        CompositeResult composite = compositeClassifier.classify(signals, calendar, request.intraday());
        GroupFiring groups = GroupFiring.from(signals, compositeClassifier.config().coreGroupMin());
        flowLogger.logComposite(symbol, composite, groups, calendar.fomcBlackout(), traceId);

        // ── sizing ─────────────────────────────────────────────────────────
        RiskBudgetResult budget = riskBudgetSizer.computeBudget(
            groups, composite.name(), request.capital(), calendar.modifier());
        flowLogger.logBudget(symbol, budget, traceId);

        // ── structures ─────────────────────────────────────────────────────
        List<StructureScore> ranked = structureSelector.rank(request.snapshot(),
            SelectionContext.from(groups, composite.name(), request.ivRank()));
        StructureScore top = composite.hasComposite() && composite.name().isBearish()
            ? StructureSelector.bestWithBias(ranked, StructureBias.BEARISH).orElse(ranked.get(0))
            : ranked.get(0);
        flowLogger.logStructures(symbol, top, traceId);

        double deployed  = request.deployedToday() != null ? request.deployedToday() : 0.0;
        double remaining = riskBudgetSizer.remainingDailyBudget(request.capital(), deployed);

        return new DecisionReport(symbol, date, signals, alerts(signals), calendar, composite, groups,
            budget, ranked, top, remaining, traceId);
    }

    /** Keys a reporting collaborator should notify on. */
    static List<String> alerts(Map<String, SignalRecord> signals) {
        return signals.values().stream()
            .filter(r -> r.level().isAtLeast(SignalLevel.WARNING))
            .map(SignalRecord::key)
            .toList();
    }
}
