package io.mersel.ucdoc.application.models;

import java.util.Objects;

/**
 * Bir faktörün alabileceği tek bir seviye (değer eşitliği).
 */
public record FactorLevel(String text) {

    public FactorLevel {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return text;
    }
}
