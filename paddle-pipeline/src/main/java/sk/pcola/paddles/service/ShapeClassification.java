package sk.pcola.paddles.service;

import sk.pcola.paddles.dto.Shape;

/**
 * Tvar a dôvod, prečo bol zvolený.
 */
public record ShapeClassification(Shape shape, Basis basis) {

    public enum Basis {
        LENGTH,
        KEYWORD,
        DEFAULT
    }

    public boolean isDefaulted() {
        return basis == Basis.DEFAULT;
    }
}
