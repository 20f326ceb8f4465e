package sk.pcola.paddles.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import sk.pcola.paddles.document.SourceDocument;
import sk.pcola.paddles.dto.FieldDiagnostic;
import sk.pcola.paddles.dto.ProductRecord;
import sk.pcola.paddles.dto.Shape;
import sk.pcola.paddles.extraction.FieldResolver;
import sk.pcola.paddles.service.BrandDetector;
import sk.pcola.paddles.service.ShapeClassifier;
import sk.pcola.paddles.service.SurfaceClassifier;
import sk.pcola.paddles.site.SiteProfile;
import sk.pcola.paddles.site.SiteProfileRegistry;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaddleRecordAssemblerTest {

    private static final SiteProfileRegistry REGISTRY = new SiteProfileRegistry(new ObjectMapper());

    private final PaddleRecordAssembler assembler = new PaddleRecordAssembler(
            new FieldResolver(), new ShapeClassifier(), new SurfaceClassifier(), new BrandDetector());

    private static final String GALAXY_PAGE = """
            <html><head><title>Selkirk SLK Era Power | Pickleball Galaxy</title></head><body>
            <span itemprop="name">Selkirk SLK Era Power Elongated Pickleball Paddle</span>
            <div class="o-layout__item">Paddle Length: 16.5 in</div>
            <div class="o-layout__item">Weight: 7.9-8.3 ounces</div>
            <div class="o-layout__item">Surface Material: Raw Carbon Fiber</div>
            <div class="o-layout__item">Grip Size: 4 1/4 in *may vary</div>
            <div class="prod_description">The SLK Era Power has a 16mm core. Built for power.</div>
            <img id="main_image" src="graphics/00000001/era_480x480.jpg">
            </body></html>
            """;

    private static final String CENTRAL_PAGE = """
            <html><body>
            <h1 class="productView-title">JOOLA Ben Johns Perseus CFS 16mm Pickleball Paddle</h1>
            <div id="tab-spec"><div class="tab-inner">
            Manufacturer: JOOLA<br>
            Average Weight: 8.0 oz<br>
            Paddle Length: 16.5"<br>
            Paddle Width: 7.5"<br>
            Grip Circumference: 4 1/4"<br>
            Handle Length: 5.5"<br>
            Paddle Face: Carbon Friction Surface<br>
            Core Thickness: 16mm<br>
            Grip Style: Feel-Tec Pure
            </div></div>
            </body></html>
            """;

    private static SourceDocument page(String html, String url) {
        return SourceDocument.parse(html, url, Instant.parse("2024-05-01T10:00:00Z"));
    }

    private AssemblyOutcome.Assembled assembled(String html, String url, SiteProfile profile) {
        AssemblyOutcome outcome = assembler.assemble(page(html, url), profile);
        return assertInstanceOf(AssemblyOutcome.Assembled.class, outcome);
    }

    private AssemblyOutcome.Rejected rejected(String html, String url, SiteProfile profile) {
        AssemblyOutcome outcome = assembler.assemble(page(html, url), profile);
        return assertInstanceOf(AssemblyOutcome.Rejected.class, outcome);
    }

    @Test
    void shouldAssembleGalaxyProductPage() {
        String url = "https://www.pickleballgalaxy.com/selkirk-slk-era-power.html";
        AssemblyOutcome.Assembled result = assembled(GALAXY_PAGE, url, REGISTRY.byId("pickleball-galaxy"));
        ProductRecord record = result.record();

        assertEquals("selkirk-slk-era-power", record.id());
        assertEquals("Selkirk", record.metadata().brand());
        assertEquals("SLK Era Power", record.metadata().model());
        assertEquals("Pickleball Galaxy", record.metadata().source());

        assertEquals(Shape.ELONGATED, record.specs().shape());
        assertEquals("Carbon Fiber", record.specs().surface());
        assertEquals(16.5, record.specs().paddleLength(), 0.0001);
        assertEquals(8.1, record.specs().averageWeight(), 0.0001);
        assertEquals(16.0, record.specs().core(), 0.0001);
        assertEquals(4.25, record.specs().gripCircumference(), 0.0001);
        assertNull(record.specs().paddleWidth());
        assertNull(record.performance());

        assertEquals(url, result.url());
        assertEquals("https://www.pickleballgalaxy.com/mm5/graphics/00000001/era_480x480.jpg",
                result.image().orElseThrow());
        assertEquals(List.of("paddle_width", "grip_length", "grip_type"), result.diagnostics().missingFieldNames());
    }

    @Test
    void shouldAssembleCentralPageWithExplicitManufacturer() {
        String url = "https://pickleballcentral.com/joola-perseus-cfs-16/";
        AssemblyOutcome.Assembled result = assembled(CENTRAL_PAGE, url, REGISTRY.byId("pickleball-central"));
        ProductRecord record = result.record();

        assertEquals("Joola", record.metadata().brand());
        assertEquals("Ben Johns Perseus CFS 16mm", record.metadata().model());
        assertEquals("joola-ben-johns-perseus-cfs-16mm", record.id());
        assertEquals("Pickleball Central", record.metadata().source());

        assertEquals(8.0, record.specs().averageWeight(), 0.0001);
        assertEquals(7.5, record.specs().paddleWidth(), 0.0001);
        assertEquals(5.5, record.specs().gripLength(), 0.0001);
        assertEquals(16.0, record.specs().core(), 0.0001);
        assertEquals("Feel-Tec Pure", record.specs().gripType());
        assertEquals("Carbon Friction Surface", record.specs().surface());
        assertEquals(Shape.ELONGATED, record.specs().shape());
        assertTrue(result.diagnostics().isComplete());
        assertTrue(result.image().isEmpty());
    }

    @Test
    void shouldRejectNavigationTitle() {
        String html = "<html><head><title>Products</title></head><body><h1>Products</h1></body></html>";

        AssemblyOutcome.Rejected result = rejected(html, "https://shop.example.com/products", REGISTRY.byId("generic"));

        assertEquals("https://shop.example.com/products", result.url());
        assertTrue(result.reason().contains("navigation"));
    }

    @Test
    void shouldRejectPageWithoutTitle() {
        String html = "<html><body><p>Nothing to see here</p></body></html>";

        rejected(html, "https://shop.example.com/empty", REGISTRY.byId("generic"));
    }

    @Test
    void shouldRejectWhenModelIsEmptyAfterCleaning() {
        String html = "<html><body><h1>Selkirk Pickleball Paddle</h1></body></html>";

        AssemblyOutcome.Rejected result = rejected(html, "https://shop.example.com/p/1", REGISTRY.byId("generic"));

        assertTrue(result.reason().startsWith("model empty"));
    }

    @Test
    void shouldFallBackToHeadTitleForShortHeading() {
        String html = "<html><head><title>Selkirk SLK Era Power - Shop</title></head>"
                + "<body><h1>Era</h1></body></html>";

        ProductRecord record = assembled(html, "https://shop.example.com/p/1", REGISTRY.byId("generic")).record();

        assertEquals("Selkirk", record.metadata().brand());
        assertEquals("SLK Era Power", record.metadata().model());
    }

    @Test
    void shouldDeriveTitleFromUrlWhenTitleIsTooShort() {
        String html = "<html><body><h1>JOOLA X</h1></body></html>";

        ProductRecord record = assembled(html, "https://shop.example.com/joola-hyperion-cfs-16.html",
                REGISTRY.byId("generic")).record();

        assertEquals("Joola", record.metadata().brand());
        assertEquals("Hyperion Cfs 16", record.metadata().model());
    }

    @Test
    void shouldReportUnparseableValueAndKeepPerformance() {
        String html = """
                <html><body>
                <h1>Vatic Pro Flash 16mm</h1>
                <ul>
                  <li>Weight: heavy</li>
                  <li>Shape: Hybrid</li>
                  <li>Power: 8.5</li>
                  <li>Spin: 9</li>
                </ul>
                </body></html>
                """;

        AssemblyOutcome.Assembled result = assembled(html, "https://shop.example.com/products/1234",
                REGISTRY.byId("generic"));
        ProductRecord record = result.record();

        assertEquals("Vatic", record.metadata().brand());
        assertEquals("Pro Flash 16mm", record.metadata().model());
        assertEquals("Web", record.metadata().source());
        assertNull(record.specs().averageWeight());
        assertEquals(Shape.HYBRID, record.specs().shape());

        assertNotNull(record.performance());
        assertEquals(8.5, record.performance().power(), 0.0001);
        assertEquals(9.0, record.performance().spin(), 0.0001);
        assertNull(record.performance().pop());

        assertTrue(result.diagnostics().missing()
                .contains(new FieldDiagnostic("average_weight", "unparseable: 'heavy'")));
        assertFalse(result.diagnostics().missingFieldNames().contains("shape"));
    }

    @Test
    void shouldReportDefaultedShape() {
        String html = "<html><body><h1>Vatic Pro Flash 16mm</h1></body></html>";

        AssemblyOutcome.Assembled result = assembled(html, "https://shop.example.com/products/1234",
                REGISTRY.byId("generic"));

        assertEquals(Shape.WIDE_BODY, result.record().specs().shape());
        assertTrue(result.diagnostics().missing()
                .contains(new FieldDiagnostic("shape", FieldDiagnostic.DEFAULTED_SHAPE)));
        assertTrue(result.diagnostics().missingFieldNames().contains("surface"));
        assertNull(result.record().performance());
    }

    @Test
    void shouldStripSourceNamesFromModel() {
        assertEquals("Vanguard Power Air",
                assembler.modelName("Selkirk Vanguard Power Air Pickleball Galaxy Exclusive",
                        "Selkirk", List.of("Pickleball Galaxy", "Exclusive")));
    }

    @Test
    void shouldTitleCaseUrlSlug() {
        assertEquals("Gearbox Pro Power Elongated",
                PaddleRecordAssembler.titleFromUrl("https://x.com/p/gearbox-pro_power-elongated.html").orElseThrow());
        assertTrue(PaddleRecordAssembler.titleFromUrl("https://x.com/p/gearbox/").isEmpty());
        assertTrue(PaddleRecordAssembler.titleFromUrl(null).isEmpty());
    }

    @Test
    void shouldReadPrimaryUnitOfDualUnitSpecs() {
        String html = """
                <html><body>
                <h1>Gearbox Pro Power Fusion</h1>
                <ul>
                  <li>Weight: 8 oz / 227 g</li>
                  <li>Paddle Length: 16.5 in / 41.9 cm</li>
                </ul>
                </body></html>
                """;

        ProductRecord record = assembled(html, "https://shop.example.com/products/77", REGISTRY.byId("generic")).record();

        assertEquals(8.0, record.specs().averageWeight(), 0.0001);
        assertEquals(16.5, record.specs().paddleLength(), 0.0001);
        assertEquals(Shape.ELONGATED, record.specs().shape());
    }
}
