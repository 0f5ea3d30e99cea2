package com.volsignal.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DailyBudget(
    @JsonProperty("capital") double capital,
    @JsonProperty("maxDailyBudget") double maxDailyBudget,
    @JsonProperty("deployedToday") double deployedToday,
    @JsonProperty("remaining") double remaining
) {}
