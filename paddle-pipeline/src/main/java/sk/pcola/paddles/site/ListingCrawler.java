package sk.pcola.paddles.site;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import sk.pcola.paddles.document.PageFetchException;
import sk.pcola.paddles.document.PageFetcher;
import sk.pcola.paddles.document.SourceDocument;
import sk.pcola.paddles.scrape.PoliteDelay;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Prejde zoznam produktov obchodu a vráti URL produktových stránok v poradí nájdenia, bez duplicít.
 *
 * Stránkovanie končí, keď strana nemá žiadne odkazy, keď od druhej strany chýba odkaz
 * "ďalej", alebo po {@code maxPages} stranách.
 */
@Component
public class ListingCrawler {

    private static final Logger log = LoggerFactory.getLogger(ListingCrawler.class);

    private final PageFetcher fetcher;
    private final PoliteDelay delay;

    public ListingCrawler(PageFetcher fetcher, PoliteDelay delay) {
        this.fetcher = fetcher;
        this.delay = delay;
    }

    public List<String> crawl(SiteProfile profile) throws PageFetchException {
        return crawl(profile, () -> false);
    }

    /**
     * @param cancelled kontroluje sa pred každou stranou, po zrušení vráti doteraz nájdené URL
     */
    public List<String> crawl(SiteProfile profile, BooleanSupplier cancelled) throws PageFetchException {
        ListingSpec listing = profile.listingSpec().orElseThrow(() ->
                new IllegalArgumentException("Site '" + profile.id() + "' has no listing configured"));

        Set<String> urls = new LinkedHashSet<>();
        for (int page = 1; page <= listing.maxPages(); page++) {
            if (page > 1) {
                delay.pause();
            }
            if (cancelled.getAsBoolean()) {
                log.info("Listing crawl of {} cancelled before page {}", profile.id(), page);
                break;
            }
            String pageUrl = listing.pageUrl(page);
            log.info("Fetching listing page {}: {}", page, pageUrl);

            SourceDocument document = fetcher.fetch(pageUrl);
            List<String> links = productLinks(document, listing);
            if (links.isEmpty()) {
                log.warn("No product links found on page {} of {}", page, profile.id());
                break;
            }
            log.info("Found {} product links on page {}", links.size(), page);
            urls.addAll(links);

            if (!listing.isPaginated() || (page > 1 && !hasNextPage(document, listing))) {
                log.info("No more listing pages after page {}", page);
                break;
            }
        }
        log.info("Found total of {} product URLs for {}", urls.size(), profile.id());
        return new ArrayList<>(urls);
    }

    private List<String> productLinks(SourceDocument document, ListingSpec listing) {
        for (String selector : listing.linkSelectors()) {
            List<String> hrefs = document.attributes(selector, "href");
            if (!hrefs.isEmpty()) {
                return hrefs.stream().map(document::resolveUrl).distinct().toList();
            }
        }
        return List.of();
    }

    private boolean hasNextPage(SourceDocument document, ListingSpec listing) {
        return listing.nextPageSelectors().stream().anyMatch(document::exists);
    }
}
