package sk.pcola.paddles.catalog;

import sk.pcola.paddles.dto.ExtractionDiagnostics;
import sk.pcola.paddles.dto.ProductRecord;

import java.util.Optional;

/**
 * Výsledok spracovania jednej produktovej stránky.
 */
public sealed interface AssemblyOutcome permits AssemblyOutcome.Assembled, AssemblyOutcome.Rejected {

    String url();

    /**
     * @param imageUrl absolútna URL hlavného obrázka alebo null
     */
    record Assembled(ProductRecord record, ExtractionDiagnostics diagnostics, String imageUrl)
            implements AssemblyOutcome {

        @Override
        public String url() {
            return diagnostics.url();
        }

        public Optional<String> image() {
            return Optional.ofNullable(imageUrl);
        }
    }

    record Rejected(String url, String reason) implements AssemblyOutcome {
    }
}
