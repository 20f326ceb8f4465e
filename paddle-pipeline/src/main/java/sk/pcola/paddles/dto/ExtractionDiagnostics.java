package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Diagnostika jedného zostaveného záznamu - vracia sa spolu so záznamom, nie cez log.
 */
public record ExtractionDiagnostics(
        @JsonProperty("id") String id,
        @JsonProperty("url") String url,
        @JsonProperty("source") String source,
        @JsonProperty("missing") List<FieldDiagnostic> missing
) {
    public ExtractionDiagnostics {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    @JsonIgnore
    public boolean isComplete() {
        return missing.isEmpty();
    }

    public List<String> missingFieldNames() {
        return missing.stream().map(FieldDiagnostic::field).toList();
    }
}
