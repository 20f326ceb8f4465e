package sk.pcola.paddles.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import sk.pcola.paddles.config.ScrapeConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Sťahovanie produktových a listing stránok cez java.net.http.
 */
@Component
public class HttpPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);

    private final ScrapeConfig config;
    private final HttpClient httpClient;

    public HttpPageFetcher(ScrapeConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public SourceDocument fetch(String url) throws PageFetchException {
        log.debug("Fetching {}", url);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new PageFetchException(url, "Invalid URL: " + e.getMessage(), e);
        }

        try {
            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

            if (response.statusCode() != 200) {
                throw new PageFetchException(url, "HTTP status " + response.statusCode());
            }

            // Po presmerovaní parsujeme voči finálnej URL, aby sedeli relatívne odkazy
            String finalUrl = response.uri() != null ? response.uri().toString() : url;
            return SourceDocument.parse(response.body(), finalUrl, Instant.now());

        } catch (IOException e) {
            throw new PageFetchException(url, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(url, "Interrupted", e);
        }
    }
}
