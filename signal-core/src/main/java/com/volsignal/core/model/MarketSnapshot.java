package com.volsignal.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One symbol's vol-surface summary at one observation time, keyed by the
 * provider's field names ({@code iv30d}, {@code dlt25Iv30d}, {@code contango}, ...).
 *
 * <p>Absent, null and non-finite fields all read as missing. {@link #get(String)}
 * never throws and returns {@code 0.0} for a missing field.
 */
public final class MarketSnapshot {

    private static final MarketSnapshot EMPTY = new MarketSnapshot(Map.of());

    private final Map<String, Double> values;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public MarketSnapshot(Map<String, ? extends Number> values) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null && Double.isFinite(v.doubleValue())) {
                    copy.put(k, v.doubleValue());
                }
            });
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static MarketSnapshot of(Map<String, ? extends Number> values) {
        return new MarketSnapshot(values);
    }

    public static MarketSnapshot empty() {
        return EMPTY;
    }

    /** Value of {@code key}, or {@code 0.0} when missing. */
    public double get(String key) {
        return get(key, 0.0);
    }

    public double get(String key, double fallback) {
        Double v = values.get(key);
        return v != null ? v : fallback;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, Double> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MarketSnapshot other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MarketSnapshot" + values;
    }
}
