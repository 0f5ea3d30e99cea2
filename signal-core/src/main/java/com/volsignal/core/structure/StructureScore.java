package com.volsignal.core.structure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked catalog entry.
 *
 * @param structure catalog structure
 * @param score     total points, composite bonus included
 * @param reason    the conditions that contributed points, in evaluation order
 */
@JsonIgnoreProperties(value = "bias", allowGetters = true)
public record StructureScore(
    @JsonProperty("structure") TradeStructure structure,
    @JsonProperty("score") double score,
    @JsonProperty("reason") String reason
) {
    @JsonProperty("bias")
    public StructureBias bias() {
        return structure.bias();
    }
}
