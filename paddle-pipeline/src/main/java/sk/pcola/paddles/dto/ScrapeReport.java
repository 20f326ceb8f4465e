package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Výstup jedného behu scrapovania - zapisuje sa do JSON súboru
 * a neskôr z neho číta upload do katalógu.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrapeReport(
        @JsonProperty("site") String site,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("records") List<ProductRecord> records,
        @JsonProperty("diagnostics") List<ExtractionDiagnostics> diagnostics,
        @JsonProperty("rejected") List<Rejection> rejected
) {
    public ScrapeReport {
        records = records == null ? List.of() : List.copyOf(records);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    /**
     * Stránka, z ktorej nevznikol záznam.
     */
    public record Rejection(
            @JsonProperty("url") String url,
            @JsonProperty("reason") String reason
    ) {}
}
