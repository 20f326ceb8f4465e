package sk.pcola.paddles.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import sk.pcola.paddles.document.SourceDocument;
import sk.pcola.paddles.strategy.ExtractionStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Nájde surový text poľa skúšaním stratégií v deklarovanom poradí.
 * Prvý neprázdny výsledok vyhráva, ďalšie stratégie sa už nespúšťajú.
 *
 * Bezstavový, dá sa volať z viacerých vlákien naraz.
 */
@Component
public class FieldResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldResolver.class);

    public ExtractionResult resolve(SourceDocument document, FieldSpec spec) {
        for (ExtractionStrategy strategy : spec.strategies()) {
            Optional<String> value = tryStrategy(document, spec, strategy);
            if (value.isPresent() && !value.get().isBlank()) {
                log.debug("Field '{}' resolved by {} on {}", spec.name(), strategy.describe(), document.url());
                return new ExtractionResult.Resolved(spec.name(), value.get().trim(), strategy.describe());
            }
        }
        log.debug("Field '{}' not found on {}", spec.name(), document.url());
        return new ExtractionResult.Missing(spec.name());
    }

    public ResolvedFields resolveAll(SourceDocument document, List<FieldSpec> specs) {
        List<ExtractionResult> results = new ArrayList<>(specs.size());
        for (FieldSpec spec : specs) {
            results.add(resolve(document, spec));
        }
        return new ResolvedFields(results);
    }

    private Optional<String> tryStrategy(SourceDocument document, FieldSpec spec, ExtractionStrategy strategy) {
        try {
            return strategy.extract(document);
        } catch (RuntimeException e) {
            // Pokazená stratégia (napr. neplatný selektor) sa správa ako prázdna
            log.warn("Strategy {} failed for field '{}' on {}: {}",
                    strategy.describe(), spec.name(), document.url(), e.getMessage());
            return Optional.empty();
        }
    }
}
