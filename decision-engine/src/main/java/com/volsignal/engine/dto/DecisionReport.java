package com.volsignal.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.volsignal.core.calendar.CalendarContext;
import com.volsignal.core.classifier.CompositeResult;
import com.volsignal.core.model.GroupFiring;
import com.volsignal.core.model.SignalRecord;
import com.volsignal.core.risk.RiskBudgetResult;
import com.volsignal.core.structure.StructureScore;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Full pipeline output for one request: every signal, the calendar overlay, the
 * composite verdict, the sized budget and the ranked structures.
 *
 * @param alerts       wire keys at WARNING or ACTION level, for the alerting collaborator
 * @param topStructure best structure matching the composite's direction
 */
public record DecisionReport(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("signals") Map<String, SignalRecord> signals,
    @JsonProperty("alerts") List<String> alerts,
    @JsonProperty("calendar") CalendarContext calendar,
    @JsonProperty("composite") CompositeResult composite,
    @JsonProperty("groups") GroupFiring groups,
    @JsonProperty("budget") RiskBudgetResult budget,
    @JsonProperty("structures") List<StructureScore> structures,
    @JsonProperty("topStructure") StructureScore topStructure,
    @JsonProperty("remainingDailyBudget") double remainingDailyBudget,
    @JsonProperty("traceId") String traceId
) {}
