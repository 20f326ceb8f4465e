package sk.pcola.paddles.service;

import org.junit.jupiter.api.Test;
import sk.pcola.paddles.dto.Shape;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ShapeClassifierTest {

    private final ShapeClassifier classifier = new ShapeClassifier();

    @Test
    void shouldClassifyByLength() {
        assertEquals(Shape.ELONGATED, classifier.classify(OptionalDouble.of(16.5), ""));
        assertEquals(Shape.ELONGATED, classifier.classify(OptionalDouble.of(17.0), ""));
        assertEquals(Shape.HYBRID, classifier.classify(OptionalDouble.of(16.25), ""));
        assertEquals(Shape.HYBRID, classifier.classify(OptionalDouble.of(16.4), ""));
        assertEquals(Shape.WIDE_BODY, classifier.classify(OptionalDouble.of(16.0), ""));
    }

    @Test
    void shouldPreferLengthOverKeywords() {
        assertEquals(Shape.WIDE_BODY, classifier.classify(OptionalDouble.of(15.75), "an elongated feel"));
    }

    @Test
    void shouldClassifyByKeywordWithoutLength() {
        assertEquals(Shape.HYBRID, classifier.classify(OptionalDouble.empty(), "this is a hybrid paddle"));
        assertEquals(Shape.ELONGATED, classifier.classify(OptionalDouble.empty(), "Long handle, Elongated face"));
        assertEquals(Shape.WIDE_BODY, classifier.classify(OptionalDouble.empty(), "A classic Wide-Body shape"));
    }

    @Test
    void shouldEvaluateElongatedBeforeHybrid() {
        assertEquals(Shape.ELONGATED, classifier.classify(OptionalDouble.empty(), "hybrid core, elongated shape"));
    }

    @Test
    void shouldMatchWholeWordsOnly() {
        assertEquals(Shape.WIDE_BODY, classifier.classify(OptionalDouble.empty(), "longevity guaranteed"));
        assertTrue(classifier.classifyDetailed(OptionalDouble.empty(), "longevity guaranteed").isDefaulted());
    }

    @Test
    void shouldDefaultToWideBody() {
        ShapeClassification result = classifier.classifyDetailed(OptionalDouble.empty(), "");

        assertEquals(Shape.WIDE_BODY, result.shape());
        assertEquals(ShapeClassification.Basis.DEFAULT, result.basis());
        assertEquals(Shape.WIDE_BODY, classifier.classify(OptionalDouble.empty(), null));
    }

    @Test
    void shouldReportClassificationBasis() {
        assertEquals(ShapeClassification.Basis.LENGTH,
                classifier.classifyDetailed(OptionalDouble.of(16.0), "hybrid").basis());
        assertEquals(ShapeClassification.Basis.KEYWORD,
                classifier.classifyDetailed(OptionalDouble.empty(), "hybrid").basis());
    }

    @Test
    void shouldNormalizeFreeTextLabels() {
        assertEquals(Shape.WIDE_BODY, classifier.normalize("WIDE BODY"));
        assertEquals(Shape.WIDE_BODY, classifier.normalize("wide_body"));
        assertEquals(Shape.WIDE_BODY, classifier.normalize("Widebody"));
        assertEquals(Shape.ELONGATED, classifier.normalize("  Elongated  "));
        assertEquals(Shape.HYBRID, classifier.normalize("Hybrid Shape"));
        assertEquals(Shape.WIDE_BODY, classifier.normalize("Standard"));
        assertEquals(Shape.WIDE_BODY, classifier.normalize("round-ish"));
        assertEquals(Shape.WIDE_BODY, classifier.normalize(null));
    }
}
