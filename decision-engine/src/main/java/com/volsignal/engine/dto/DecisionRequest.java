package com.volsignal.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.volsignal.core.model.CreditQuad;
import com.volsignal.core.model.MarketSnapshot;
import com.volsignal.core.model.ReferenceState;

import java.time.LocalDate;

/**
 * One evaluation request from the polling orchestrator.
 *
 * <p>The orchestrator owns the per-symbol {@code reference} pair and sends it on
 * every call; the engine keeps nothing between requests.
 *
 * @param symbol        underlying, required
 * @param snapshot      vol-surface summary row, required
 * @param reference     baseline / previous-day snapshots; null compares against the snapshot itself
 * @param credit        credit-proxy closes; null leaves credit_spread neutral
 * @param date          trading date for the calendar overlay; null means today in the engine zone
 * @param intraday      true selects the bearish intraday cascade
 * @param capital       capital override for sizing
 * @param ivRank        IV rank override for structure ranking
 * @param deployedToday risk already deployed today, for the remaining daily budget
 */
public record DecisionRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("snapshot") MarketSnapshot snapshot,
    @JsonProperty("reference") ReferenceState reference,
    @JsonProperty("credit") CreditQuad credit,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("intraday") boolean intraday,
    @JsonProperty("capital") Double capital,
    @JsonProperty("ivRank") Double ivRank,
    @JsonProperty("deployedToday") Double deployedToday
) {
    public static DecisionRequest daily(String symbol, MarketSnapshot snapshot, ReferenceState reference,
                                        LocalDate date) {
        return new DecisionRequest(symbol, snapshot, reference, null, date, false, null, null, null);
    }
}
