package sk.pcola.paddles.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Výsledky všetkých polí jednej stránky, v poradí deklarácie.
 */
public final class ResolvedFields {

    private final Map<String, ExtractionResult> results;

    public ResolvedFields(List<ExtractionResult> results) {
        Map<String, ExtractionResult> byField = new LinkedHashMap<>();
        for (ExtractionResult result : results) {
            byField.put(result.field(), result);
        }
        this.results = Collections.unmodifiableMap(byField);
    }

    public Optional<String> value(String field) {
        ExtractionResult result = results.get(field);
        return result == null ? Optional.empty() : result.value();
    }

    public Optional<ExtractionResult> result(String field) {
        return Optional.ofNullable(results.get(field));
    }

    /**
     * Polia, ktoré nenašla žiadna stratégia.
     */
    public List<String> missingFields() {
        return results.values().stream()
                .filter(r -> !r.isResolved())
                .map(ExtractionResult::field)
                .toList();
    }

    public Map<String, ExtractionResult> asMap() {
        return results;
    }
}
