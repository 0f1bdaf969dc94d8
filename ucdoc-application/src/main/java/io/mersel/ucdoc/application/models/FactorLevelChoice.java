package io.mersel.ucdoc.application.models;

import java.util.Objects;

/**
 * (faktör, seviye) çifti.
 */
public record FactorLevelChoice(String factorId, FactorLevel level) {

    public FactorLevelChoice {
        Objects.requireNonNull(factorId, "factorId");
        Objects.requireNonNull(level, "level");
    }

    public static FactorLevelChoice of(String factorId, String level) {
        return new FactorLevelChoice(factorId, new FactorLevel(level));
    }

    @Override
    public String toString() {
        return factorId + "=" + level.text();
    }
}
