package sk.pcola.paddles.strategy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import sk.pcola.paddles.document.SourceDocument;

import java.util.Optional;

/**
 * Jedna heuristika, ako nájsť surový text poľa na stránke.
 * Stratégie sú dáta - deklarujú sa v profiloch obchodov (sites/*.json) pod kľúčom "type".
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = KeyValueStrategy.class, name = "key-value"),
        @JsonSubTypes.Type(value = RegexStrategy.class, name = "regex"),
        @JsonSubTypes.Type(value = KeywordSentenceStrategy.class, name = "keyword-sentence"),
        @JsonSubTypes.Type(value = SelectorStrategy.class, name = "selector"),
        @JsonSubTypes.Type(value = AttributeStrategy.class, name = "attribute")
})
public sealed interface ExtractionStrategy
        permits KeyValueStrategy, RegexStrategy, KeywordSentenceStrategy, SelectorStrategy, AttributeStrategy {

    /**
     * @return neprázdny text, alebo prázdny Optional ak stratégia nič nenašla
     */
    Optional<String> extract(SourceDocument document);

    /**
     * Krátky popis pre diagnostiku, napr. {@code key-value[paddle length]}.
     */
    String describe();
}
