package com.volsignal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current and previous closes of the two credit-proxy assets
 * (high-yield credit ETF and long-duration treasury ETF).
 * Any component may be null when the upstream fetch failed.
 */
public record CreditQuad(
    @JsonProperty("primary") Double primary,
    @JsonProperty("hedge") Double hedge,
    @JsonProperty("primaryPrevious") Double primaryPrevious,
    @JsonProperty("hedgePrevious") Double hedgePrevious
) {
    public static CreditQuad of(Double primary, Double hedge, Double primaryPrevious, Double hedgePrevious) {
        return new CreditQuad(primary, hedge, primaryPrevious, hedgePrevious);
    }
}
