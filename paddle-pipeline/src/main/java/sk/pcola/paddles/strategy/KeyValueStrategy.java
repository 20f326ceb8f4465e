package sk.pcola.paddles.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.common.util.TextUtil;
import sk.pcola.paddles.document.SourceDocument;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Hľadá riadky tvaru "kľúč: hodnota" v bloku so špecifikáciami.
 *
 * Kľúč sa porovnáva presne, po prevode na malé písmená a zlúčení medzier.
 * Ak je kľúč s dvojbodkou na samostatnom riadku, hodnotou je nasledujúci riadok
 * ({@code <dt>Weight:</dt><dd>8 oz</dd>}). Vyhráva prvý zhodný riadok.
 *
 * @param region CSS selektor bloku, napr. ".o-layout__item"
 * @param keys   aliasy kľúča, napr. ["paddle length", "length"]
 */
public record KeyValueStrategy(
        @JsonProperty("region") String region,
        @JsonProperty("keys") List<String> keys
) implements ExtractionStrategy {

    public KeyValueStrategy {
        keys = keys == null ? List.of() : keys.stream().map(KeyValueStrategy::normalizeKey).toList();
    }

    @Override
    public Optional<String> extract(SourceDocument document) {
        List<String> lines = document.lines(region);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = normalizeKey(line.substring(0, colon));
            if (!keys.contains(key)) {
                continue;
            }
            String value = TextUtil.emptyToNull(line.substring(colon + 1));
            if (value == null && i + 1 < lines.size() && lines.get(i + 1).indexOf(':') < 0) {
                value = lines.get(i + 1);
            }
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "key-value" + keys;
    }

    static String normalizeKey(String key) {
        String normalized = TextUtil.normalize(key).toLowerCase(Locale.ROOT);
        while (normalized.endsWith(":")) {
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        }
        return normalized;
    }
}
