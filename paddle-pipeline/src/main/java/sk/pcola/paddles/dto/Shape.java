package sk.pcola.paddles.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tvar pálky. Uzavretá množina troch hodnôt, ktoré akceptuje cieľový katalóg.
 */
public enum Shape {

    ELONGATED("Elongated"),
    HYBRID("Hybrid"),
    WIDE_BODY("Wide-body");

    private final String label;

    Shape(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Shape fromLabel(String label) {
        for (Shape shape : values()) {
            if (shape.label.equalsIgnoreCase(label) || shape.name().equalsIgnoreCase(label)) {
                return shape;
            }
        }
        throw new IllegalArgumentException("Unknown paddle shape: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
