package sk.pcola.paddles.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typ cieľovej hodnoty poľa - určuje, ako sa surový text normalizuje.
 */
public enum FieldType {
    @JsonProperty("float")
    FLOAT,
    @JsonProperty("enum")
    ENUM,
    @JsonProperty("text")
    TEXT
}
