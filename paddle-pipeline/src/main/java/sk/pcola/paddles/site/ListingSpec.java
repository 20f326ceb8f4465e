package sk.pcola.paddles.site;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ako prejsť zoznam produktov obchodu.
 *
 * Prvá strana je vždy {@code url}, ďalšie sa skladajú z {@code pageUrlTemplate}
 * (zástupné symboly {@code {offset}} a {@code {perPage}}). Bez šablóny sa číta len prvá strana.
 *
 * @param linkSelectors     selektory odkazov na produkty, prvý s výsledkom vyhráva
 * @param nextPageSelectors ak ani jeden nenájde element, stránkovanie končí
 */
public record ListingSpec(
        @JsonProperty("url") String url,
        @JsonProperty("page_url_template") String pageUrlTemplate,
        @JsonProperty("per_page") int perPage,
        @JsonProperty("max_pages") int maxPages,
        @JsonProperty("link_selectors") List<String> linkSelectors,
        @JsonProperty("next_page_selectors") List<String> nextPageSelectors
) {
    public ListingSpec {
        perPage = perPage <= 0 ? 40 : perPage;
        maxPages = maxPages <= 0 ? 1 : maxPages;
        linkSelectors = linkSelectors == null ? List.of() : List.copyOf(linkSelectors);
        nextPageSelectors = nextPageSelectors == null ? List.of() : List.copyOf(nextPageSelectors);
    }

    /**
     * URL strany (číslované od 1).
     */
    public String pageUrl(int page) {
        if (page <= 1 || pageUrlTemplate == null || pageUrlTemplate.isBlank()) {
            return url;
        }
        int offset = (page - 1) * perPage;
        return pageUrlTemplate
                .replace("{offset}", String.valueOf(offset))
                .replace("{perPage}", String.valueOf(perPage));
    }

    @JsonIgnore
    public boolean isPaginated() {
        return pageUrlTemplate != null && !pageUrlTemplate.isBlank() && maxPages > 1;
    }
}
