package sk.pcola.paddles.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.document.SourceDocument;

import java.util.List;
import java.util.Optional;

/**
 * Text prvého neprázdneho elementu, selektory sa skúšajú v poradí.
 */
public record SelectorStrategy(@JsonProperty("selectors") List<String> selectors) implements ExtractionStrategy {

    public SelectorStrategy {
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
    }

    @Override
    public Optional<String> extract(SourceDocument document) {
        for (String selector : selectors) {
            Optional<String> text = document.firstText(selector);
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "selector" + selectors;
    }
}
