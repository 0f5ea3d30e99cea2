package com.volsignal.core.risk;

/**
 * Coarse strength of a signal set, reported next to the risk budget.
 * Informational: it never feeds back into sizing.
 */
public enum SignalStrength {
    NONE,
    MODERATE,
    STRONG,
    VERY_STRONG,
    EXTREME
}
