package sk.pcola.paddles;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import sk.pcola.paddles.catalog.AssemblyOutcome;
import sk.pcola.paddles.catalog.CatalogUploader;
import sk.pcola.paddles.catalog.PaddleRecordAssembler;
import sk.pcola.paddles.document.SourceDocument;
import sk.pcola.paddles.dto.ScrapeReport;
import sk.pcola.paddles.scrape.PaddleScrapeJob;
import sk.pcola.paddles.site.SiteProfile;
import sk.pcola.paddles.site.SiteProfileRegistry;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI runner pre scrapovanie a upload pálok.
 *
 * Použitie:
 *   java -jar paddle-pipeline.jar --scrape=pickleball-galaxy
 *   java -jar paddle-pipeline.jar --extract=page.html --url=https://pickleballcentral.com/x.html
 *   java -jar paddle-pipeline.jar --upload=scraped_paddles.json
 *   java -jar paddle-pipeline.jar --sites
 */
@Component
public class PaddleCommandLineRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PaddleCommandLineRunner.class);

    private final PaddleScrapeJob scrapeJob;
    private final PaddleRecordAssembler assembler;
    private final CatalogUploader uploader;
    private final SiteProfileRegistry profiles;
    private final ObjectMapper objectMapper;

    public PaddleCommandLineRunner(PaddleScrapeJob scrapeJob,
                                   PaddleRecordAssembler assembler,
                                   CatalogUploader uploader,
                                   SiteProfileRegistry profiles,
                                   ObjectMapper objectMapper) {
        this.scrapeJob = scrapeJob;
        this.assembler = assembler;
        this.uploader = uploader;
        this.profiles = profiles;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            printHelp();
            return;
        }

        log.info("CLI arguments: {}", Arrays.toString(args));
        Map<String, String> options = parseOptions(args);

        for (String arg : args) {
            String name = optionName(arg);
            String value = options.get(name);
            switch (name) {
                case "--scrape" -> runScrape(value);
                case "--extract" -> runExtract(value, options.get("--url"), options.get("--site"));
                case "--upload" -> runUpload(value);
                case "--sites" -> printSites();
                case "--help" -> printHelp();
                case "--url", "--site" -> {
                    // hodnoty pre --extract
                }
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    private void runScrape(String siteId) {
        if (siteId == null || siteId.isBlank()) {
            log.error("--scrape requires a site id, e.g. --scrape=pickleball-galaxy");
            return;
        }
        try {
            ScrapeReport report = scrapeJob.run(siteId);
            log.info("Scrape completed:");
            log.info("  Site:     {}", report.site());
            log.info("  Records:  {}", report.records().size());
            log.info("  Rejected: {}", report.rejected().size());
            log.info("  Incomplete: {}", report.diagnostics().stream().filter(d -> !d.isComplete()).count());
        } catch (Exception e) {
            log.error("Scrape failed: {}", e.getMessage(), e);
        }
    }

    private void runExtract(String file, String url, String siteId) {
        if (file == null || file.isBlank()) {
            log.error("--extract requires a file, e.g. --extract=page.html");
            return;
        }
        try {
            Path path = Path.of(file);
            String pageUrl = url != null ? url : path.toAbsolutePath().toUri().toString();
            SiteProfile profile = siteId != null ? profiles.byId(siteId) : profiles.forUrl(pageUrl);
            log.info("Extracting {} with site profile '{}'", path, profile.id());

            String html = Files.readString(path, StandardCharsets.UTF_8);
            SourceDocument document = SourceDocument.parse(html, pageUrl, Instant.now());
            AssemblyOutcome outcome = assembler.assemble(document, profile);

            if (outcome instanceof AssemblyOutcome.Assembled assembled) {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsString(assembled.record()));
                if (!assembled.diagnostics().isComplete()) {
                    log.warn("Missing fields: {}", assembled.diagnostics().missing());
                }
            } else if (outcome instanceof AssemblyOutcome.Rejected rejected) {
                log.warn("Page rejected: {}", rejected.reason());
            }
        } catch (Exception e) {
            log.error("Extraction failed: {}", e.getMessage(), e);
        }
    }

    private void runUpload(String reportFile) {
        if (reportFile == null || reportFile.isBlank()) {
            log.error("--upload requires a report file, e.g. --upload=scraped_paddles.json");
            return;
        }
        try {
            ScrapeReport report = scrapeJob.readReport(Path.of(reportFile));
            CatalogUploader.UploadResult result = uploader.upload(report.records());
            log.info("Upload completed:");
            log.info("  Created:   {}", result.created());
            log.info("  Duplicate: {}", result.duplicate());
            log.info("  Failed:    {}", result.failed());
            log.info("  Total:     {}", result.total());
        } catch (Exception e) {
            log.error("Upload failed: {}", e.getMessage(), e);
        }
    }

    private void printSites() {
        log.info("=== Site profiles ===");
        for (SiteProfile profile : profiles.all()) {
            log.info("  {} - {} (hosts: {}, fields: {}, listing: {})",
                    profile.id(), profile.source(), profile.hosts(), profile.fields().size(),
                    profile.listingSpec().map(l -> l.url()).orElse("none"));
        }
    }

    static Map<String, String> parseOptions(String... args) {
        Map<String, String> options = new LinkedHashMap<>();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            options.put(optionName(arg), eq < 0 ? null : arg.substring(eq + 1));
        }
        return options;
    }

    private static String optionName(String arg) {
        int eq = arg.indexOf('=');
        return eq < 0 ? arg : arg.substring(0, eq);
    }

    private void printHelp() {
        System.out.println("""
            Paddle Pipeline - CLI Commands

            Usage: java -jar paddle-pipeline.jar [options]

            Options:
              --scrape=<site>     Scrape all paddles of a site and write the report
              --extract=<file>    Extract one saved product page and print the record
                --url=<url>       Original page URL (selects the site profile)
                --site=<site>     Site profile to use instead of URL detection
              --upload=<report>   Upload records of a scrape report to the catalog API
              --sites             List site profiles
              --help              Show this help

            Examples:
              java -jar paddle-pipeline.jar --scrape=pickleball-galaxy
              java -jar paddle-pipeline.jar --upload=scraped_paddles.json
            """);
    }
}
