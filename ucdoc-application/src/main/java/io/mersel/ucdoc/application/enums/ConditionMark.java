package io.mersel.ucdoc.application.enums;

/**
 * Karar tablosu koşul satırı işareti.
 */
public enum ConditionMark {
    YES("Y"),
    NONE("");

    private final String symbol;

    ConditionMark(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
