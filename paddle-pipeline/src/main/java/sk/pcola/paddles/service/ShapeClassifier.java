package sk.pcola.paddles.service;

import org.springframework.stereotype.Component;
import sk.pcola.paddles.dto.Shape;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Určí tvar pálky z dĺžky, inak z kľúčových slov v texte.
 *
 * Dĺžka (palce): od 16.5 Elongated, od 16.25 Hybrid, menej Wide-body.
 * Kľúčové slová sa hľadajú ako celé slová v poradí Elongated, Hybrid, Wide-body.
 */
@Component
public class ShapeClassifier {

    static final double ELONGATED_MIN_LENGTH = 16.5;
    static final double HYBRID_MIN_LENGTH = 16.25;

    private static final List<Pattern> ELONGATED = keywords("elongated", "long");
    private static final List<Pattern> HYBRID = keywords("hybrid");
    private static final List<Pattern> WIDE_BODY = keywords(
            "wide-body", "widebody", "wide body", "standard", "traditional", "classic", "teardrop");

    public Shape classify(OptionalDouble length, String description) {
        return classifyDetailed(length, description).shape();
    }

    /**
     * Ako {@link #classify}, ale vráti aj to, odkiaľ tvar pochádza.
     */
    public ShapeClassification classifyDetailed(OptionalDouble length, String description) {
        if (length != null && length.isPresent()) {
            return new ShapeClassification(fromLength(length.getAsDouble()), ShapeClassification.Basis.LENGTH);
        }
        Shape byKeyword = fromKeywords(description);
        if (byKeyword != null) {
            return new ShapeClassification(byKeyword, ShapeClassification.Basis.KEYWORD);
        }
        return new ShapeClassification(Shape.WIDE_BODY, ShapeClassification.Basis.DEFAULT);
    }

    /**
     * Ľubovoľný textový popis tvaru ("WIDE BODY", "wide_body", "Elongated shape") na jednu z troch hodnôt.
     * Nerozpoznaný text je Wide-body.
     */
    public Shape normalize(String label) {
        Shape shape = fromKeywords(label);
        return shape != null ? shape : Shape.WIDE_BODY;
    }

    /**
     * @return tvar podľa kľúčových slov alebo null, ak text žiadne neobsahuje
     */
    Shape fromKeywords(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String input = text.replace('_', ' ').replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);

        if (matches(input, ELONGATED)) {
            return Shape.ELONGATED;
        }
        if (matches(input, HYBRID)) {
            return Shape.HYBRID;
        }
        if (matches(input, WIDE_BODY)) {
            return Shape.WIDE_BODY;
        }
        return null;
    }

    private Shape fromLength(double length) {
        if (length >= ELONGATED_MIN_LENGTH) {
            return Shape.ELONGATED;
        }
        if (length >= HYBRID_MIN_LENGTH) {
            return Shape.HYBRID;
        }
        return Shape.WIDE_BODY;
    }

    private boolean matches(String input, List<Pattern> keywords) {
        for (Pattern kw : keywords) {
            if (kw.matcher(input).find()) return true;
        }
        return false;
    }

    private static List<Pattern> keywords(String... words) {
        return Arrays.stream(words)
                .map(w -> Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(w) + "(?![\\p{L}\\p{N}])"))
                .toList();
    }
}
