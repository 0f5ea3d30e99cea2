package com.volsignal.core.model;

/**
 * Firing groups used by the composite classifier.
 * {@link #SECONDARY} signals are informational and never counted.
 */
public enum SignalGroup {
    CORE,
    WING,
    FUNDING,
    MOMENTUM,
    SECONDARY
}
