package com.volsignal.core.structure;

/**
 * Catalog of trade-structure archetypes the selector ranks.
 *
 * <p>Declaration order is the tie-break order of the ranking: on equal scores
 * the structure declared first ranks first.
 */
public enum TradeStructure {
    BULL_PUT_SPREAD("Bull Put Spread", StructureBias.BULLISH),
    LONG_CALL("Long Call", StructureBias.BULLISH),
    CALL_DEBIT_SPREAD("Call Debit Spread", StructureBias.BULLISH),
    CALL_RATIO_SPREAD("Call Ratio Spread", StructureBias.BULLISH),
    BROKEN_WING_BUTTERFLY("Broken Wing Butterfly", StructureBias.BULLISH),
    PUT_DEBIT_SPREAD("Put Debit Spread", StructureBias.BEARISH),
    LONG_PUT("Long Put", StructureBias.BEARISH),
    BEAR_CALL_SPREAD("Bear Call Spread", StructureBias.BEARISH),
    IRON_BUTTERFLY("Iron Butterfly", StructureBias.NEUTRAL),
    SHORT_IRON_CONDOR("Short Iron Condor", StructureBias.NEUTRAL);

    private final String displayName;
    private final StructureBias bias;

    TradeStructure(String displayName, StructureBias bias) {
        this.displayName = displayName;
        this.bias = bias;
    }

    public String displayName() { return displayName; }
    public StructureBias bias() { return bias; }
}
