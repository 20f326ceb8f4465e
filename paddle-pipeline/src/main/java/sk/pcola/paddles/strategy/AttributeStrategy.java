package sk.pcola.paddles.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.document.SourceDocument;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Hodnota atribútu (typicky src obrázka). Hodnoty obsahujúce niektorý z {@code exclude}
 * reťazcov sa preskočia (logá, bannery, blank.gif), ak je zadané {@code include},
 * hodnota musí obsahovať aspoň jeden z nich.
 *
 * @param urlPrefix prefix pre relatívne hodnoty; bez neho sa hodnota rozlíši voči URL stránky
 */
public record AttributeStrategy(
        @JsonProperty("selectors") List<String> selectors,
        @JsonProperty("attribute") String attribute,
        @JsonProperty("exclude") List<String> exclude,
        @JsonProperty("include") List<String> include,
        @JsonProperty("url_prefix") String urlPrefix
) implements ExtractionStrategy {

    public AttributeStrategy {
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
        exclude = exclude == null ? List.of() : exclude.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
        include = include == null ? List.of() : include.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
        if (attribute == null || attribute.isBlank()) {
            attribute = "src";
        }
    }

    @Override
    public Optional<String> extract(SourceDocument document) {
        for (String selector : selectors) {
            for (String value : document.attributes(selector, attribute)) {
                if (accepts(value)) {
                    return Optional.of(absolutize(document, value));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "attribute[" + attribute + "]" + selectors;
    }

    private boolean accepts(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (exclude.stream().anyMatch(lower::contains)) {
            return false;
        }
        return include.isEmpty() || include.stream().anyMatch(lower::contains);
    }

    private String absolutize(SourceDocument document, String value) {
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value;
        }
        if (value.startsWith("//")) {
            return "https:" + value;
        }
        if (urlPrefix != null && !urlPrefix.isBlank()) {
            String prefix = urlPrefix.endsWith("/") ? urlPrefix : urlPrefix + "/";
            return prefix + (value.startsWith("/") ? value.substring(1) : value);
        }
        return document.resolveUrl(value);
    }
}
