package sk.pcola.paddles.scrape;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sk.pcola.paddles.catalog.AssemblyOutcome;
import sk.pcola.paddles.catalog.PaddleRecordAssembler;
import sk.pcola.paddles.config.ScrapeConfig;
import sk.pcola.paddles.document.PageFetchException;
import sk.pcola.paddles.document.PageFetcher;
import sk.pcola.paddles.document.SourceDocument;
import sk.pcola.paddles.dto.ExtractionDiagnostics;
import sk.pcola.paddles.dto.ProductRecord;
import sk.pcola.paddles.dto.ScrapeReport;
import sk.pcola.paddles.site.ListingCrawler;
import sk.pcola.paddles.site.SiteProfile;
import sk.pcola.paddles.site.SiteProfileRegistry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrácia scrapovania jedného obchodu:
 * 1. Zoznam produktových URL z listingu
 * 2. Stiahnutie a zostavenie záznamov vo workeroch (pred každým requestom pauza)
 * 3. Deduplikácia podľa ID - prvý zostavený záznam vyhráva
 * 4. Zápis reportu do JSON
 *
 * Zlyhanie jednej stránky sa zapíše medzi zamietnuté a beh pokračuje.
 */
@Service
public class PaddleScrapeJob {

    private static final Logger log = LoggerFactory.getLogger(PaddleScrapeJob.class);

    private final ScrapeConfig config;
    private final SiteProfileRegistry profiles;
    private final ListingCrawler crawler;
    private final PageFetcher fetcher;
    private final PaddleRecordAssembler assembler;
    private final ImageStore imageStore;
    private final PoliteDelay delay;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public PaddleScrapeJob(ScrapeConfig config,
                           SiteProfileRegistry profiles,
                           ListingCrawler crawler,
                           PageFetcher fetcher,
                           PaddleRecordAssembler assembler,
                           ImageStore imageStore,
                           PoliteDelay delay,
                           ObjectMapper objectMapper) {
        this.config = config;
        this.profiles = profiles;
        this.crawler = crawler;
        this.fetcher = fetcher;
        this.assembler = assembler;
        this.imageStore = imageStore;
        this.delay = delay;
        this.objectMapper = objectMapper;
    }

    /**
     * Prejde listing obchodu, spracuje všetky produkty a zapíše report do {@code paddles.scrape.output-path}.
     */
    public ScrapeReport run(String siteId) {
        SiteProfile profile = profiles.byId(siteId);
        log.info("Starting scrape of {} ({})", profile.source(), profile.id());
        cancelled.set(false);

        try {
            Instant startedAt = Instant.now();
            List<String> urls = crawler.crawl(profile, cancelled::get);
            if (cancelled.get()) {
                log.info("Scrape of {} cancelled after listing, {} product URLs skipped", profile.id(), urls.size());
                return new ScrapeReport(profile.id(), startedAt, Instant.now(), List.of(), List.of(), List.of());
            }
            ScrapeReport report = scrape(profile, urls);
            writeReport(report, Path.of(config.getOutputPath()));

            log.info("Scrape of {} completed. Records: {}, Rejected: {}",
                    profile.id(), report.records().size(), report.rejected().size());
            return report;

        } catch (Exception e) {
            log.error("Scrape of {} failed: {}", profile.id(), e.getMessage(), e);
            throw new RuntimeException("Scrape of " + profile.id() + " failed", e);
        }
    }

    /**
     * Spracuje zadané produktové URL. Poradie záznamov v reporte nie je zaručené.
     * Príznak zrušenia sa tu nenuluje, nuluje ho až ďalší {@link #run}.
     */
    public ScrapeReport scrape(SiteProfile profile, List<String> urls) {
        Instant startedAt = Instant.now();

        Map<String, AssemblyOutcome.Assembled> assembled = new ConcurrentHashMap<>();
        List<ScrapeReport.Rejection> rejected = Collections.synchronizedList(new ArrayList<>());

        int threads = Math.max(1, config.getWorkerThreads());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        log.info("Processing {} product URLs with {} workers", urls.size(), threads);

        try {
            List<Future<?>> futures = new ArrayList<>(urls.size());
            for (String url : urls) {
                futures.add(executor.submit(() -> process(profile, url, assembled, rejected)));
            }
            awaitAll(futures);
        } finally {
            executor.shutdownNow();
        }

        List<ProductRecord> records = new ArrayList<>();
        List<ExtractionDiagnostics> diagnostics = new ArrayList<>();
        for (AssemblyOutcome.Assembled outcome : assembled.values()) {
            records.add(outcome.record());
            diagnostics.add(outcome.diagnostics());
        }

        return new ScrapeReport(profile.id(), startedAt, Instant.now(), records, diagnostics, rejected);
    }

    /**
     * Zastaví spracovanie: čakajúce stránky sa preskočia, rozpracované sa zahodia.
     */
    public void cancel() {
        if (!cancelled.getAndSet(true)) {
            log.info("Scrape cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void writeReport(ScrapeReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
        log.info("Report written to {} ({} records)", path, report.records().size());
    }

    public ScrapeReport readReport(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), ScrapeReport.class);
    }

    private void process(SiteProfile profile,
                         String url,
                         Map<String, AssemblyOutcome.Assembled> assembled,
                         List<ScrapeReport.Rejection> rejected) {
        if (cancelled.get()) {
            return;
        }
        try {
            delay.pause();
            if (cancelled.get()) {
                return;
            }

            SourceDocument document = fetcher.fetch(url);
            AssemblyOutcome outcome = assembler.assemble(document, profile);
            if (cancelled.get()) {
                return;
            }

            if (outcome instanceof AssemblyOutcome.Assembled result) {
                AssemblyOutcome.Assembled previous = assembled.putIfAbsent(result.record().id(), result);
                if (previous != null) {
                    log.info("Duplicate paddle {} from {} (already scraped from {})",
                            result.record().id(), url, previous.url());
                    return;
                }
                if (config.isDownloadImages()) {
                    result.image().ifPresent(image -> imageStore.store(
                            result.record().metadata().brand(), result.record().metadata().model(), image));
                }
            } else if (outcome instanceof AssemblyOutcome.Rejected rejection) {
                rejected.add(new ScrapeReport.Rejection(rejection.url(), rejection.reason()));
            }

        } catch (PageFetchException e) {
            log.error("Failed to fetch {}: {}", url, e.getMessage());
            rejected.add(new ScrapeReport.Rejection(url, "fetch failed: " + e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to process {}: {}", url, e.getMessage(), e);
            rejected.add(new ScrapeReport.Rejection(url, "processing failed: " + e.getMessage()));
        }
    }

    private void awaitAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Worker failed: {}", e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                return;
            }
        }
    }
}
