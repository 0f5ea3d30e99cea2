package com.volsignal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One signal evaluation. Recomputed on every call and never stored by the core.
 *
 * @param key           wire key, e.g. {@code "skew_25d_rr"}
 * @param label         dashboard label
 * @param value         derived value the threshold was applied to (rounded for reporting)
 * @param level         assigned {@link SignalLevel}
 * @param tier          1 = feeds composite counts, 2–3 = informational
 * @param group         firing group of the signal
 * @param baseline      session baseline of the value, when the signal compares against one
 * @param previousValue previous-day value, when the signal compares against one
 * @param change        change that was thresholded, when it differs from {@code value}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignalRecord(
    @JsonProperty("key") String key,
    @JsonProperty("label") String label,
    @JsonProperty("value") double value,
    @JsonProperty("level") SignalLevel level,
    @JsonProperty("tier") int tier,
    @JsonProperty("group") SignalGroup group,
    @JsonProperty("baseline") Double baseline,
    @JsonProperty("previousValue") Double previousValue,
    @JsonProperty("change") Double change
) {
    public static SignalRecord of(SignalKey key, double value, SignalLevel level) {
        return new SignalRecord(key.key(), key.label(), value, level, key.tier(), key.group(),
            null, null, null);
    }

    public SignalRecord withBaseline(double baseline) {
        return new SignalRecord(key, label, value, level, tier, group, baseline, previousValue, change);
    }

    public SignalRecord withPreviousValue(double previous) {
        return new SignalRecord(key, label, value, level, tier, group, baseline, previous, change);
    }

    public SignalRecord withChange(double change) {
        return new SignalRecord(key, label, value, level, tier, group, baseline, previousValue, change);
    }

    @JsonIgnore
    public boolean isAction() {
        return level == SignalLevel.ACTION;
    }

    @JsonIgnore
    public boolean isTier1Action() {
        return tier == 1 && level == SignalLevel.ACTION;
    }
}
