package com.volsignal.core.risk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.volsignal.core.model.CompositeSignal;

/**
 * Output of {@link RiskBudgetSizer#computeBudget}.
 *
 * <p>{@code 0 ≤ riskBudget ≤ capital × maxRiskPct} holds for every result.
 *
 * @param riskBudget          dollar risk for the prospective trade, rounded to cents
 * @param baseRisk            capital × baseRiskPct
 * @param multiplier          product of the four factors below and the calendar modifier
 * @param coreMultiplier      core-count lookup, after the non-core floor
 * @param compositeMultiplier composite lookup
 * @param groupBonus          1 + extra groups × groupBonusPct
 * @param coreCount           core ACTION signals
 * @param groupsFiring        groups firing (0–4)
 * @param composite           composite the budget was sized for, may be null
 * @param strength            informational strength class
 * @param capital             capital the budget was sized against
 */
public record RiskBudgetResult(
    @JsonProperty("riskBudget") double riskBudget,
    @JsonProperty("baseRisk") double baseRisk,
    @JsonProperty("multiplier") double multiplier,
    @JsonProperty("coreMultiplier") double coreMultiplier,
    @JsonProperty("compositeMultiplier") double compositeMultiplier,
    @JsonProperty("groupBonus") double groupBonus,
    @JsonProperty("coreCount") int coreCount,
    @JsonProperty("groupsFiring") int groupsFiring,
    @JsonProperty("composite") CompositeSignal composite,
    @JsonProperty("strength") SignalStrength strength,
    @JsonProperty("capital") double capital
) {}
