package sk.pcola.paddles.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sk.pcola.paddles.common.util.NameCleaner;
import sk.pcola.paddles.common.util.NumericNormalizer;
import sk.pcola.paddles.common.util.TextUtil;
import sk.pcola.paddles.document.SourceDocument;
import sk.pcola.paddles.dto.ExtractionDiagnostics;
import sk.pcola.paddles.dto.FieldDiagnostic;
import sk.pcola.paddles.dto.Metadata;
import sk.pcola.paddles.dto.Performance;
import sk.pcola.paddles.dto.ProductRecord;
import sk.pcola.paddles.dto.Specs;
import sk.pcola.paddles.extraction.FieldResolver;
import sk.pcola.paddles.extraction.FieldSpec;
import sk.pcola.paddles.extraction.ResolvedFields;
import sk.pcola.paddles.service.BrandDetector;
import sk.pcola.paddles.service.ShapeClassification;
import sk.pcola.paddles.service.ShapeClassifier;
import sk.pcola.paddles.service.SurfaceClassifier;
import sk.pcola.paddles.site.SiteProfile;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Zostavenie záznamu pálky z jednej produktovej stránky.
 *
 * Proces:
 * 1. Nájdi surové hodnoty polí podľa profilu obchodu
 * 2. Urči titulok (so zálohami z hlavičky a z URL), značku a model
 * 3. Normalizuj čísla, povrch a tvar
 * 4. Zostav záznam a diagnostiku chýbajúcich polí
 *
 * Stránka bez použiteľného titulku, značky alebo modelu sa zamietne.
 * Trieda nemá stav, volá sa paralelne z viacerých workerov.
 */
@Service
public class PaddleRecordAssembler {

    private static final Logger log = LoggerFactory.getLogger(PaddleRecordAssembler.class);

    static final List<String> NAVIGATION_TITLES = List.of("home", "products", "categories", "paddles");

    private static final int MIN_TITLE_LENGTH = 5;
    private static final int MIN_DESCRIPTIVE_TITLE_LENGTH = 10;

    private static final Pattern HEAD_TITLE_SEPARATOR = Pattern.compile("\\s+[-|]\\s+");

    private final FieldResolver fieldResolver;
    private final ShapeClassifier shapeClassifier;
    private final SurfaceClassifier surfaceClassifier;
    private final BrandDetector brandDetector;

    public PaddleRecordAssembler(FieldResolver fieldResolver,
                                 ShapeClassifier shapeClassifier,
                                 SurfaceClassifier surfaceClassifier,
                                 BrandDetector brandDetector) {
        this.fieldResolver = fieldResolver;
        this.shapeClassifier = shapeClassifier;
        this.surfaceClassifier = surfaceClassifier;
        this.brandDetector = brandDetector;
    }

    public AssemblyOutcome assemble(SourceDocument document, SiteProfile profile) {
        String url = document.url();
        AssemblyState state = AssemblyState.FETCHED;

        ResolvedFields fields = fieldResolver.resolveAll(document, profile.fields());
        state = state.transitionTo(AssemblyState.FIELDS_RESOLVED);

        // Titulok, značka, model
        Optional<String> title = resolveTitle(document, fields.value(PaddleFields.TITLE));
        if (title.isEmpty()) {
            return reject(state, url, "title missing or navigation text");
        }

        Optional<String> brand = fields.value(PaddleFields.BRAND)
                .flatMap(brandDetector::canonical)
                .or(() -> brandDetector.detect(title.get(), url));
        if (brand.isEmpty()) {
            return reject(state, url, "brand not found in '" + title.get() + "'");
        }

        String model = modelName(title.get(), brand.get(), profile.sourceNames());
        if (model.isEmpty()) {
            return reject(state, url, "model empty after cleaning '" + title.get() + "'");
        }
        log.debug("Title '{}' -> brand '{}', model '{}'", title.get(), brand.get(), model);

        // Normalizácia hodnôt
        List<FieldDiagnostic> missing = new ArrayList<>();
        for (String field : PaddleFields.REPORTED_SPECS) {
            if (fields.value(field).isEmpty() && !PaddleFields.SURFACE.equals(field)) {
                missing.add(FieldDiagnostic.notFound(field));
            }
        }

        String description = fields.value(PaddleFields.DESCRIPTION).orElse("");
        String surface = fields.value(PaddleFields.SURFACE)
                .flatMap(surfaceClassifier::fromSpec)
                .or(() -> surfaceClassifier.fromDescription(description))
                .orElse(null);
        if (surface == null) {
            missing.add(FieldDiagnostic.notFound(PaddleFields.SURFACE));
        }

        Double length = number(fields, profile, PaddleFields.PADDLE_LENGTH, missing);
        ShapeClassification shape = classifyShape(length, fields.value(PaddleFields.SHAPE), title.get(), description);
        if (shape.isDefaulted()) {
            missing.add(new FieldDiagnostic(PaddleFields.SHAPE, FieldDiagnostic.DEFAULTED_SHAPE));
        }

        Specs specs = new Specs(
                shape.shape(),
                surface,
                number(fields, profile, PaddleFields.AVERAGE_WEIGHT, missing),
                number(fields, profile, PaddleFields.CORE, missing),
                length,
                number(fields, profile, PaddleFields.PADDLE_WIDTH, missing),
                number(fields, profile, PaddleFields.GRIP_LENGTH, missing),
                fields.value(PaddleFields.GRIP_TYPE).orElse(null),
                number(fields, profile, PaddleFields.GRIP_CIRCUMFERENCE, missing)
        );

        Performance performance = new Performance(
                number(fields, profile, PaddleFields.POWER, missing),
                number(fields, profile, PaddleFields.POP, missing),
                number(fields, profile, PaddleFields.SPIN, missing),
                number(fields, profile, PaddleFields.TWIST_WEIGHT, missing),
                number(fields, profile, PaddleFields.SWING_WEIGHT, missing),
                number(fields, profile, PaddleFields.BALANCE_POINT, missing)
        );
        state = state.transitionTo(AssemblyState.NORMALIZED);

        // Záznam
        ProductRecord record = ProductRecord.of(new Metadata(brand.get(), model, profile.source()), specs, performance);
        ExtractionDiagnostics diagnostics = new ExtractionDiagnostics(record.id(), url, profile.source(), missing);
        state = state.transitionTo(AssemblyState.ASSEMBLED);

        if (!diagnostics.isComplete()) {
            log.warn("Incomplete record {} from {}: {}", record.id(), url, diagnostics.missingFieldNames());
        }
        log.info("Assembled {} ({} {}) from {}", record.id(), brand.get(), model, url);

        return new AssemblyOutcome.Assembled(record, diagnostics, fields.value(PaddleFields.IMAGE).orElse(null));
    }

    /**
     * Titulok stránky so zálohami:
     * - krátky alebo navigačný titulok nahradí {@code <title>} z hlavičky (časť pred " - " / " | ")
     * - navigačný text aj po zálohe znamená zamietnutie
     * - titulok kratší ako 10 znakov nahradí názov odvodený z URL ({@code foo-bar.html -> Foo Bar})
     */
    Optional<String> resolveTitle(SourceDocument document, Optional<String> resolved) {
        String title = resolved.map(TextUtil::normalize).orElse(null);

        if (title == null || title.length() < MIN_TITLE_LENGTH || isNavigation(title)) {
            if (title != null) {
                log.warn("Suspicious title '{}' on {}, trying page title", title, document.url());
            }
            title = document.headTitle()
                    .map(t -> HEAD_TITLE_SEPARATOR.split(t, 2)[0].trim())
                    .orElse(null);
        }
        if (title == null || title.isEmpty()) {
            log.warn("No title found on {}", document.url());
            return Optional.empty();
        }
        if (isNavigation(title)) {
            log.warn("Title appears to be navigation text: '{}' on {}", title, document.url());
            return Optional.empty();
        }

        if (title.length() < MIN_DESCRIPTIVE_TITLE_LENGTH) {
            Optional<String> fromUrl = titleFromUrl(document.url());
            if (fromUrl.isPresent()) {
                log.info("Replaced short title '{}' with URL-derived name '{}'", title, fromUrl.get());
                return fromUrl;
            }
        }
        return Optional.of(title);
    }

    /**
     * Model = titulok bez značky na začiatku a bez názvov obchodu, vyčistený.
     */
    String modelName(String title, String brand, List<String> sourceNames) {
        String model = Pattern.compile("^" + Pattern.quote(brand) + "\\s+", Pattern.CASE_INSENSITIVE)
                .matcher(title.trim())
                .replaceFirst("");
        model = NameCleaner.clean(model);
        for (String source : sourceNames) {
            model = Pattern.compile("\\b" + Pattern.quote(source) + "\\b", Pattern.CASE_INSENSITIVE)
                    .matcher(model)
                    .replaceAll("");
        }
        return NameCleaner.clean(model);
    }

    static Optional<String> titleFromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (path == null) {
            return Optional.empty();
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        int extension = segment.indexOf(".htm");
        if (extension <= 0) {
            return Optional.empty();
        }

        StringBuilder sb = new StringBuilder();
        for (String word : segment.substring(0, extension).split("[-_]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.isEmpty() ? Optional.empty() : Optional.of(sb.toString());
    }

    private ShapeClassification classifyShape(Double length, Optional<String> label, String title, String description) {
        if (length != null) {
            return shapeClassifier.classifyDetailed(OptionalDouble.of(length), null);
        }
        if (label.isPresent()) {
            ShapeClassification fromLabel = shapeClassifier.classifyDetailed(OptionalDouble.empty(), label.get());
            if (!fromLabel.isDefaulted()) {
                return fromLabel;
            }
        }
        return shapeClassifier.classifyDetailed(OptionalDouble.empty(), title + ". " + description);
    }

    /**
     * Číselná hodnota poľa. Text, ktorý sa nedá prečítať, sa zapíše do diagnostiky a pole ostane null.
     */
    private Double number(ResolvedFields fields, SiteProfile profile, String field, List<FieldDiagnostic> missing) {
        Optional<String> raw = fields.value(field);
        if (raw.isEmpty()) {
            return null;
        }
        List<String> units = profile.field(field).map(FieldSpec::units).orElse(List.of());
        OptionalDouble value = NumericNormalizer.normalize(raw.get(), units);
        if (value.isEmpty()) {
            log.warn("Unparseable value for '{}': '{}'", field, raw.get());
            missing.add(FieldDiagnostic.unparseable(field, raw.get()));
            return null;
        }
        return value.getAsDouble();
    }

    private boolean isNavigation(String title) {
        return NAVIGATION_TITLES.contains(title.trim().toLowerCase(Locale.ROOT));
    }

    private AssemblyOutcome reject(AssemblyState state, String url, String reason) {
        state.transitionTo(AssemblyState.REJECTED);
        log.warn("Rejected {}: {}", url, reason);
        return new AssemblyOutcome.Rejected(url, reason);
    }
}
