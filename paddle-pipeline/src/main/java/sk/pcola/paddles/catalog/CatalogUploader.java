package sk.pcola.paddles.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sk.pcola.paddles.config.CatalogConfig;
import sk.pcola.paddles.dto.CatalogPaddleInput;
import sk.pcola.paddles.dto.ProductRecord;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Odoslanie hotových záznamov do katalógového API (POST JSON, bez id a source).
 *
 * 201 = vytvorené, 409 = pálka už existuje, čokoľvek iné alebo chyba spojenia = chyba.
 * Chyba jedného záznamu nezastaví ostatné.
 */
@Service
public class CatalogUploader {

    private static final Logger log = LoggerFactory.getLogger(CatalogUploader.class);

    private final CatalogConfig config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public CatalogUploader(CatalogConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build();
    }

    public enum UploadStatus {
        CREATED,
        DUPLICATE,
        ERROR
    }

    /**
     * Výsledok uploadu.
     */
    public record UploadResult(
            int created,
            int duplicate,
            int failed
    ) {
        public int total() {
            return created + duplicate + failed;
        }
    }

    public UploadResult upload(List<ProductRecord> records) {
        if (!config.isEnabled()) {
            log.info("Catalog upload is disabled, skipping {} records", records.size());
            return new UploadResult(0, 0, 0);
        }
        log.info("Uploading {} paddles to {}", records.size(), config.getUrl());

        int created = 0;
        int duplicate = 0;
        int failed = 0;

        for (int i = 0; i < records.size(); i++) {
            ProductRecord record = records.get(i);
            log.debug("Uploading paddle {} ({}/{})", record.id(), i + 1, records.size());

            switch (uploadOne(record)) {
                case CREATED -> created++;
                case DUPLICATE -> duplicate++;
                case ERROR -> failed++;
            }
        }

        UploadResult result = new UploadResult(created, duplicate, failed);
        log.info("Upload completed: {}", result);
        return result;
    }

    public UploadStatus uploadOne(ProductRecord record) {
        try {
            String body = objectMapper.writeValueAsString(CatalogPaddleInput.from(record));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getUrl()))
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

            return switch (response.statusCode()) {
                case 201 -> UploadStatus.CREATED;
                case 409 -> {
                    log.info("Paddle {} already exists in catalog", record.id());
                    yield UploadStatus.DUPLICATE;
                }
                default -> {
                    log.error("Failed to upload paddle {} (HTTP {}): {}",
                            record.id(), response.statusCode(), response.body());
                    yield UploadStatus.ERROR;
                }
            };

        } catch (JsonProcessingException e) {
            log.error("Failed to serialize paddle {}: {}", record.id(), e.getMessage());
            return UploadStatus.ERROR;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to upload paddle {}: {}", record.id(), e.getMessage());
            return UploadStatus.ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Upload of paddle {} interrupted", record.id());
            return UploadStatus.ERROR;
        }
    }
}
