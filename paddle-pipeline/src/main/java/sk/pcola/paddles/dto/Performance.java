package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Výkonnostné hodnotenia pálky, ak ich stránka uvádza. Nikdy sa negenerujú.
 */
public record Performance(
        @JsonProperty("power") Double power,
        @JsonProperty("pop") Double pop,
        @JsonProperty("spin") Double spin,
        @JsonProperty("twist_weight") Double twistWeight,
        @JsonProperty("swing_weight") Double swingWeight,
        @JsonProperty("balance_point") Double balancePoint
) {
    @JsonIgnore
    public boolean isEmpty() {
        return power == null && pop == null && spin == null
                && twistWeight == null && swingWeight == null && balancePoint == null;
    }
}
