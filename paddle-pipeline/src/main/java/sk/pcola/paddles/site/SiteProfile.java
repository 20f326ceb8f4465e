package sk.pcola.paddles.site;

import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.extraction.FieldSpec;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tabuľka pravidiel pre jeden obchod: odkiaľ brať ktoré pole a ako prejsť zoznam produktov.
 * Profily sú čisté dáta v {@code classpath:sites/*.json}.
 *
 * @param source      zobrazovaný názov obchodu, ide do {@code metadata.source}
 * @param hosts       hostitelia, pre ktorých sa profil vyberie podľa URL
 * @param sourceNames názvy obchodu, ktoré sa odstránia z názvu modelu
 */
public record SiteProfile(
        @JsonProperty("id") String id,
        @JsonProperty("source") String source,
        @JsonProperty("hosts") List<String> hosts,
        @JsonProperty("listing") ListingSpec listing,
        @JsonProperty("source_names") List<String> sourceNames,
        @JsonProperty("fields") List<FieldSpec> fields
) {
    public SiteProfile {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Site profile requires an id");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Site profile '" + id + "' requires a source name");
        }
        hosts = hosts == null ? List.of() : hosts.stream().map(h -> h.toLowerCase(Locale.ROOT)).toList();
        sourceNames = sourceNames == null ? List.of() : List.copyOf(sourceNames);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public Optional<ListingSpec> listingSpec() {
        return Optional.ofNullable(listing);
    }

    /**
     * Patrí URL tomuto obchodu? Porovnáva sa host aj jeho subdoména ({@code www.}).
     */
    public boolean matchesUrl(String url) {
        if (url == null || hosts.isEmpty()) {
            return false;
        }
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        return hosts.stream().anyMatch(h -> lower.equals(h) || lower.endsWith("." + h));
    }
}
