package io.mersel.ucdoc.application.enums;

/**
 * Kullanım senaryosu türü.
 */
public enum ScenarioType {
    BASIC("Temel"),
    ALTERNATE("Alternatif"),
    EXCEPTION("İstisna");

    private final String displayName;

    ScenarioType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
