package sk.pcola.paddles.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.common.util.TextUtil;
import sk.pcola.paddles.document.SourceDocument;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regulárny výraz nad viditeľným textom regiónu. Výsledkom je prvá skupina prvej zhody,
 * pri výraze bez skupín celá zhoda.
 */
public final class RegexStrategy implements ExtractionStrategy {

    private final String region;
    private final String pattern;
    private final boolean caseInsensitive;
    private final Pattern compiled;

    /**
     * @throws IllegalArgumentException pri prázdnom alebo neplatnom výraze (zlý profil zlyhá už pri načítaní)
     */
    @JsonCreator
    public RegexStrategy(@JsonProperty("region") String region,
                         @JsonProperty("pattern") String pattern,
                         @JsonProperty("case_insensitive") boolean caseInsensitive) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Regex strategy requires a pattern");
        }
        this.region = region;
        this.pattern = pattern;
        this.caseInsensitive = caseInsensitive;
        this.compiled = caseInsensitive ? Pattern.compile(pattern, Pattern.CASE_INSENSITIVE) : Pattern.compile(pattern);
    }

    @JsonProperty("region")
    public String region() {
        return region;
    }

    @JsonProperty("pattern")
    public String pattern() {
        return pattern;
    }

    @JsonProperty("case_insensitive")
    public boolean caseInsensitive() {
        return caseInsensitive;
    }

    @Override
    public Optional<String> extract(SourceDocument document) {
        String text = document.text(region);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = compiled.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
        return Optional.ofNullable(TextUtil.emptyToNull(TextUtil.normalize(value)));
    }

    @Override
    public String describe() {
        return "regex[" + pattern + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegexStrategy other)) {
            return false;
        }
        return caseInsensitive == other.caseInsensitive
                && Objects.equals(region, other.region)
                && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, pattern, caseInsensitive);
    }

    @Override
    public String toString() {
        return "RegexStrategy[region=" + region + ", pattern=" + pattern + ", caseInsensitive=" + caseInsensitive + "]";
    }
}
