package com.volsignal.core.structure;

/**
 * Directional lean of a trade structure.
 */
public enum StructureBias {
    BULLISH,
    BEARISH,
    NEUTRAL
}
