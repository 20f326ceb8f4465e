package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.common.util.IdentityAssigner;

/**
 * Hotový záznam pálky. Vzniká raz pre každú úspešne spracovanú produktovú stránku
 * a po zostavení sa už nemení.
 */
public record ProductRecord(
        @JsonProperty("id") String id,
        @JsonProperty("metadata") Metadata metadata,
        @JsonProperty("specs") Specs specs,
        @JsonProperty("performance") Performance performance
) {
    /**
     * Zostaví záznam s ID odvodeným zo značky a modelu.
     */
    public static ProductRecord of(Metadata metadata, Specs specs, Performance performance) {
        String id = IdentityAssigner.assignId(metadata.brand(), metadata.model());
        Performance ratings = performance == null || performance.isEmpty() ? null : performance;
        return new ProductRecord(id, metadata, specs, ratings);
    }
}
