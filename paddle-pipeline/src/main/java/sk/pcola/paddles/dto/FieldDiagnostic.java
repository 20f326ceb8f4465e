package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Jedno chýbajúce alebo doplnené pole a dôvod.
 */
public record FieldDiagnostic(
        @JsonProperty("field") String field,
        @JsonProperty("reason") String reason
) {
    public static final String NOT_FOUND = "not found";
    public static final String DEFAULTED_SHAPE = "defaulted to Wide-body";

    public static FieldDiagnostic notFound(String field) {
        return new FieldDiagnostic(field, NOT_FOUND);
    }

    public static FieldDiagnostic unparseable(String field, String raw) {
        return new FieldDiagnostic(field, "unparseable: '" + raw + "'");
    }
}
