package sk.pcola.paddles.scrape;

import com.github.slugify.Slugify;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import sk.pcola.paddles.config.ScrapeConfig;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Obrázky na disku: {@code <imageDir>/<znacka>/<znacka>_<model>.<pripona>}.
 * Existujúci súbor sa znova nesťahuje.
 */
@Component
public class FileSystemImageStore implements ImageStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemImageStore.class);

    private static final List<String> IMAGE_EXTENSIONS = List.of("jpg", "jpeg", "png", "gif", "webp");
    private static final String DEFAULT_EXTENSION = "jpg";

    private final Path baseDir;
    private final String userAgent;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final Slugify slugify = Slugify.builder().build();

    @Autowired
    public FileSystemImageStore(ScrapeConfig config) {
        this(Path.of(config.getImageDir()), config.getUserAgent(),
                Duration.ofSeconds(config.getRequestTimeoutSeconds()));
    }

    public FileSystemImageStore(Path baseDir, String userAgent, Duration requestTimeout) {
        this.baseDir = baseDir;
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Optional<Path> store(String brand, String model, String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            log.warn("No image URL provided for {} {}", brand, model);
            return Optional.empty();
        }

        Path target = targetPath(brand, model, imageUrl);
        if (Files.exists(target)) {
            log.info("Image already exists: {}", target);
            return Optional.of(target);
        }

        try {
            Files.createDirectories(target.getParent());

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(imageUrl))
                    .timeout(requestTimeout)
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();

            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream is = response.body()) {
                if (response.statusCode() != 200) {
                    log.error("Failed to download image from {}: HTTP {}", imageUrl, response.statusCode());
                    return Optional.empty();
                }
                Files.copy(is, target, StandardCopyOption.REPLACE_EXISTING);
            }

            log.info("Downloaded image {} ({} bytes)", target, Files.size(target));
            return Optional.of(target);

        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to download image from {}: {}", imageUrl, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Image download interrupted: {}", imageUrl);
            return Optional.empty();
        }
    }

    /**
     * Cieľová cesta obrázka, bez ohľadu na to, či už existuje.
     */
    public Path targetPath(String brand, String model, String imageUrl) {
        String brandSlug = slug(brand, "unknown-brand");
        String modelSlug = slug(model, "unknown-model");
        return baseDir.resolve(brandSlug).resolve(brandSlug + "_" + modelSlug + "." + extension(imageUrl));
    }

    private String slug(String text, String fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        String slug = slugify.slugify(text);
        return slug.isEmpty() ? fallback : slug;
    }

    static String extension(String imageUrl) {
        String path;
        try {
            path = URI.create(imageUrl.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return DEFAULT_EXTENSION;
        }
        if (path == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < path.lastIndexOf('/')) {
            return DEFAULT_EXTENSION;
        }
        String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.contains(extension) ? extension : DEFAULT_EXTENSION;
    }
}
