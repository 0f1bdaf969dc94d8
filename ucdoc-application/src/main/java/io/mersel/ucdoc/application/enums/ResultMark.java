package io.mersel.ucdoc.application.enums;

/**
 * Karar tablosu sonuç satırı işareti.
 */
public enum ResultMark {
    CHECK("X"),
    NONE("");

    private final String symbol;

    ResultMark(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
