package com.volsignal.core.classifier;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.volsignal.core.model.CompositeSignal;

import java.util.List;

/**
 * Classifier verdict.
 *
 * @param name        composite verdict, or null when nothing qualifies or FOMC suppresses it
 * @param tier1Firing wire keys of tier-1 signals at ACTION level, in signal order
 * @param ruleId      id of the rule that produced {@code name}; null when {@code name} is null
 */
public record CompositeResult(
    @JsonProperty("name") CompositeSignal name,
    @JsonProperty("tier1Firing") List<String> tier1Firing,
    @JsonProperty("ruleId") String ruleId
) {
    public CompositeResult {
        tier1Firing = tier1Firing == null ? List.of() : List.copyOf(tier1Firing);
    }

    public static CompositeResult none(List<String> tier1Firing) {
        return new CompositeResult(null, tier1Firing, null);
    }

    public boolean hasComposite() {
        return name != null;
    }
}
