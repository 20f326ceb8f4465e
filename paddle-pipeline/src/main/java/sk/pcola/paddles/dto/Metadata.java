package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identita pálky a jej pôvod.
 *
 * @param source názov obchodu, z ktorého záznam pochádza (nikdy prázdny)
 */
public record Metadata(
        @JsonProperty("brand") String brand,
        @JsonProperty("model") String model,
        @JsonProperty("source") String source
) {
    public Metadata {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Metadata source must not be empty");
        }
    }
}
