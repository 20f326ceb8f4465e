package sk.pcola.paddles.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Materiál povrchu pálky na kanonický názov.
 */
@Component
public class SurfaceClassifier {

    public static final String FIBERGLASS = "Fiberglass";
    public static final String CARBON_FIBER = "Carbon Fiber";
    public static final String GRAPHITE = "Graphite";
    public static final String COMPOSITE = "Composite";

    /**
     * Hodnota zo špecifikácie. Ak nejde o známy materiál, vráti sa pôvodný text.
     */
    public Optional<String> fromSpec(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(detect(value).orElse(value.trim()));
    }

    /**
     * Záložné hľadanie materiálu v popise produktu. Tu sa berú len známe materiály.
     */
    public Optional<String> fromDescription(String description) {
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        return detect(description);
    }

    private Optional<String> detect(String text) {
        String input = text.toLowerCase(Locale.ROOT);

        if (input.contains("fiberglass")) {
            return Optional.of(FIBERGLASS);
        }
        if (input.contains("carbon") && input.contains("fiber")) {
            return Optional.of(CARBON_FIBER);
        }
        if (input.contains("graphite")) {
            return Optional.of(GRAPHITE);
        }
        if (input.contains("composite")) {
            return Optional.of(COMPOSITE);
        }
        return Optional.empty();
    }
}
