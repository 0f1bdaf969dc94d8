package io.mersel.ucdoc.application.enums;

/**
 * Kapsam doğrulamasının çalışma kipi.
 * <p>
 * {@link #STRICT} kipte kapsam boşlukları yüklemeyi durdurur,
 * {@link #LENIENT} kipte uyarı olarak raporlanır.
 */
public enum ValidationMode {
    STRICT,
    LENIENT
}
