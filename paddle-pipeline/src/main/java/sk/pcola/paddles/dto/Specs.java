package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fyzické parametre pálky. Okrem tvaru môže byť ktorékoľvek pole null -
 * na tejto úrovni sa nikdy nedopĺňajú predvolené hodnoty.
 *
 * Jednotky: váha v unciach, jadro v mm, rozmery v palcoch.
 */
public record Specs(
        @JsonProperty("shape") Shape shape,
        @JsonProperty("surface") String surface,
        @JsonProperty("average_weight") Double averageWeight,
        @JsonProperty("core") Double core,
        @JsonProperty("paddle_length") Double paddleLength,
        @JsonProperty("paddle_width") Double paddleWidth,
        @JsonProperty("grip_length") Double gripLength,
        @JsonProperty("grip_type") String gripType,
        @JsonProperty("grip_circumference") Double gripCircumference
) {
}
