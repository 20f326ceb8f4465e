package sk.pcola.paddles.extraction;

import java.util.Optional;

/**
 * Výsledok hľadania jedného poľa. K hodnote prispieva najviac jedna stratégia.
 */
public sealed interface ExtractionResult permits ExtractionResult.Resolved, ExtractionResult.Missing {

    String field();

    Optional<String> value();

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    /**
     * @param strategyUsed popis stratégie, ktorá hodnotu našla
     */
    record Resolved(String field, String rawValue, String strategyUsed) implements ExtractionResult {
        @Override
        public Optional<String> value() {
            return Optional.of(rawValue);
        }
    }

    record Missing(String field) implements ExtractionResult {
        @Override
        public Optional<String> value() {
            return Optional.empty();
        }
    }
}
