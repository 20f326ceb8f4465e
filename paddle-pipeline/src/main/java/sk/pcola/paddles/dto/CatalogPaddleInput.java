package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload pre import do katalógu pálok. Katalóg si ID generuje sám,
 * preto tu chýba id aj zdroj.
 */
public record CatalogPaddleInput(
        @JsonProperty("metadata") CatalogMetadata metadata,
        @JsonProperty("specs") Specs specs,
        @JsonProperty("performance") Performance performance
) {
    public record CatalogMetadata(
            @JsonProperty("brand") String brand,
            @JsonProperty("model") String model
    ) {}

    public static CatalogPaddleInput from(ProductRecord record) {
        return new CatalogPaddleInput(
                new CatalogMetadata(record.metadata().brand(), record.metadata().model()),
                record.specs(),
                record.performance()
        );
    }
}
