package sk.pcola.paddles.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import sk.pcola.paddles.common.util.TextUtil;
import sk.pcola.paddles.document.SourceDocument;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Prvá veta (ohraničená bodkou), ktorá obsahuje kľúčové slovo ako celé slovo.
 *
 * Text sa delí na vety podľa bodiek a kľúčové slovo sa hľadá v každej vete zvlášť,
 * takže dlhý text bez bodky sa prejde len raz.
 */
public final class KeywordSentenceStrategy implements ExtractionStrategy {

    private final String region;
    private final String keyword;
    private final Pattern wholeWord;

    @JsonCreator
    public KeywordSentenceStrategy(@JsonProperty("region") String region,
                                   @JsonProperty("keyword") String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Keyword sentence strategy requires a keyword");
        }
        this.region = region;
        this.keyword = keyword.trim();
        this.wholeWord = Pattern.compile("\\b" + Pattern.quote(this.keyword) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    @JsonProperty("region")
    public String region() {
        return region;
    }

    @JsonProperty("keyword")
    public String keyword() {
        return keyword;
    }

    @Override
    public Optional<String> extract(SourceDocument document) {
        String text = document.flatText(region);
        int start = 0;
        while (start < text.length()) {
            int dot = text.indexOf('.', start);
            int end = dot < 0 ? text.length() : dot + 1;
            String sentence = text.substring(start, end);
            if (wholeWord.matcher(sentence).find()) {
                return Optional.ofNullable(TextUtil.emptyToNull(sentence.trim()));
            }
            start = end;
        }
        return Optional.empty();
    }

    @Override
    public String describe() {
        return "keyword-sentence[" + keyword + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeywordSentenceStrategy other)) {
            return false;
        }
        return Objects.equals(region, other.region) && keyword.equals(other.keyword);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, keyword);
    }

    @Override
    public String toString() {
        return "KeywordSentenceStrategy[region=" + region + ", keyword=" + keyword + "]";
    }
}
