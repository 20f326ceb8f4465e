package sk.pcola.paddles.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SourceDocumentTest {

    private static final String HTML = """
            <html>
            <head><title>Gearbox Pro Power Elongated - Pickleball Galaxy</title></head>
            <body>
            <script>var weight = "Weight: 99 oz";</script>
            <div class="o-layout__item"><strong>Paddle Length:</strong>&nbsp;16.5 in</div>
            <div class="o-layout__item">Handle Length:<br>5.5 in</div>
            <p class="empty">   </p>
            <p class="note">Core: 16mm</p>
            <a class="link" href="/gearbox-pro-power.html">Gearbox</a>
            <a class="link" href="https://other.example.com/x.html">Other</a>
            </body>
            </html>
            """;

    private final Instant fetchedAt = Instant.parse("2024-05-01T10:00:00Z");
    private final SourceDocument document =
            SourceDocument.parse(HTML, "https://www.pickleballgalaxy.com/all-pickleball-paddles.html", fetchedAt);

    @Test
    void shouldKeepInlineElementsOnOneLine() {
        assertEquals(List.of("Paddle Length: 16.5 in", "Handle Length:", "5.5 in"),
                document.lines(".o-layout__item"));
    }

    @Test
    void shouldSkipScriptsInBodyText() {
        String text = document.text(null);

        assertFalse(text.contains("99 oz"));
        assertTrue(text.contains("Core: 16mm"));
    }

    @Test
    void shouldReturnFirstNonBlankText() {
        assertEquals(Optional.of("Core: 16mm"), document.firstText("p"));
        assertTrue(document.firstText("h1").isEmpty());
    }

    @Test
    void shouldReadHeadTitle() {
        assertEquals(Optional.of("Gearbox Pro Power Elongated - Pickleball Galaxy"), document.headTitle());
    }

    @Test
    void shouldResolveRelativeUrls() {
        List<String> hrefs = document.attributes("a.link", "href");

        assertEquals("/gearbox-pro-power.html", hrefs.get(0));
        assertEquals("https://www.pickleballgalaxy.com/gearbox-pro-power.html", document.resolveUrl(hrefs.get(0)));
        assertEquals("https://other.example.com/x.html", document.resolveUrl(hrefs.get(1)));
    }

    @Test
    void shouldExposeUrlAndFetchTime() {
        assertEquals("https://www.pickleballgalaxy.com/all-pickleball-paddles.html", document.url());
        assertEquals(fetchedAt, document.fetchedAt());
        assertTrue(document.exists("p.note"));
        assertFalse(document.exists("#tab-spec"));
    }

    @Test
    void shouldFlattenRegionText() {
        assertEquals("Core: 16mm Gearbox Other", document.flatText("p.note, a.link"));
    }
}
