package com.volsignal.core.model;

/**
 * Severity assigned to a single signal evaluation, ordered from quietest to loudest.
 *
 * <ul>
 *   <li>{@link #OK}:      threshold not crossed.</li>
 *   <li>{@link #INFO}:    tier-3 context worth showing, never alerted.</li>
 *   <li>{@link #WARNING}: tier-2 dislocation; notified but not counted.</li>
 *   <li>{@link #ACTION}:  tier-1 trigger; counted by the composite classifier.</li>
 * </ul>
 */
public enum SignalLevel {
    OK,
    INFO,
    WARNING,
    ACTION;

    public boolean isAtLeast(SignalLevel other) {
        return compareTo(other) >= 0;
    }
}
