package sk.pcola.paddles.extraction;

import org.junit.jupiter.api.Test;
import sk.pcola.paddles.document.SourceDocument;
import sk.pcola.paddles.strategy.KeyValueStrategy;
import sk.pcola.paddles.strategy.RegexStrategy;
import sk.pcola.paddles.strategy.SelectorStrategy;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldResolverTest {

    private static final String HTML = """
            <html><body>
            <h1>Engage Pursuit MX 6.0</h1>
            <ul class="specs">
              <li>Paddle Length: 16.5 in</li>
              <li>Surface Material: Raw Toray T700</li>
            </ul>
            <div class="description">Thermoformed with a 14mm core for control.</div>
            </body></html>
            """;

    private final FieldResolver resolver = new FieldResolver();
    private final SourceDocument document = SourceDocument.parse(HTML, "https://shop.example.com/p.html", Instant.now());

    @Test
    void shouldFallBackToSecondStrategy() {
        KeyValueStrategy keyValue = new KeyValueStrategy(".specs", List.of("core thickness"));
        RegexStrategy regex = new RegexStrategy(".description", "(\\d+)\\s*mm\\s*core", true);
        FieldSpec spec = FieldSpec.of("core", FieldType.FLOAT, keyValue, regex);

        ExtractionResult result = resolver.resolve(document, spec);

        ExtractionResult.Resolved resolved = assertInstanceOf(ExtractionResult.Resolved.class, result);
        assertEquals("14", resolved.rawValue());
        assertEquals(regex.describe(), resolved.strategyUsed());
    }

    @Test
    void shouldStopAtFirstSuccessfulStrategy() {
        KeyValueStrategy keyValue = new KeyValueStrategy(".specs", List.of("paddle length"));
        RegexStrategy regex = new RegexStrategy(null, "(\\d+)mm", false);
        FieldSpec spec = FieldSpec.of("paddle_length", FieldType.FLOAT, keyValue, regex);

        ExtractionResult.Resolved resolved =
                assertInstanceOf(ExtractionResult.Resolved.class, resolver.resolve(document, spec));

        assertEquals("16.5 in", resolved.rawValue());
        assertEquals(keyValue.describe(), resolved.strategyUsed());
    }

    @Test
    void shouldTreatFailingStrategyAsEmpty() {
        SelectorStrategy broken = new SelectorStrategy(List.of("div[unclosed"));
        SelectorStrategy title = new SelectorStrategy(List.of("h1"));
        FieldSpec spec = FieldSpec.of("title", FieldType.TEXT, broken, title);

        ExtractionResult result = resolver.resolve(document, spec);

        assertEquals(Optional.of("Engage Pursuit MX 6.0"), result.value());
        assertTrue(result.isResolved());
    }

    @Test
    void shouldReportMissingField() {
        FieldSpec spec = FieldSpec.of("grip_type", FieldType.TEXT,
                new KeyValueStrategy(".specs", List.of("factory grip")));

        ExtractionResult result = resolver.resolve(document, spec);

        assertEquals(new ExtractionResult.Missing("grip_type"), result);
        assertTrue(result.value().isEmpty());
    }

    @Test
    void shouldResolveAllFieldsAndListMissing() {
        List<FieldSpec> specs = List.of(
                FieldSpec.of("title", FieldType.TEXT, new SelectorStrategy(List.of("h1"))),
                FieldSpec.of("surface", FieldType.TEXT, new KeyValueStrategy(".specs", List.of("surface material"))),
                FieldSpec.of("grip_type", FieldType.TEXT, new KeyValueStrategy(".specs", List.of("factory grip"))),
                FieldSpec.of("core", FieldType.FLOAT)
        );

        ResolvedFields fields = resolver.resolveAll(document, specs);

        assertEquals(Optional.of("Raw Toray T700"), fields.value("surface"));
        assertEquals(List.of("grip_type", "core"), fields.missingFields());
        assertTrue(fields.value("unknown").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> fields.asMap().clear());
    }
}
