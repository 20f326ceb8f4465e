package sk.pcola.paddles.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.strategy.ExtractionStrategy;

import java.util.List;

/**
 * Deklarácia jedného poľa: kde ho hľadať (stratégie v poradí priority) a ako ho čítať.
 *
 * @param units doplnkové jednotky, ktoré sa odstránia pred parsovaním čísla
 */
public record FieldSpec(
        @JsonProperty("name") String name,
        @JsonProperty("type") FieldType type,
        @JsonProperty("strategies") List<ExtractionStrategy> strategies,
        @JsonProperty("units") List<String> units
) {
    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field spec requires a name");
        }
        type = type == null ? FieldType.TEXT : type;
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
        units = units == null ? List.of() : List.copyOf(units);
    }

    public static FieldSpec of(String name, FieldType type, ExtractionStrategy... strategies) {
        return new FieldSpec(name, type, List.of(strategies), List.of());
    }
}
