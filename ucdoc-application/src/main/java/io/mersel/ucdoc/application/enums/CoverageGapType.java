package io.mersel.ucdoc.application.enums;

/**
 * Kapsam doğrulamasında tespit edilen boşluk türleri.
 */
public enum CoverageGapType {
    /** Hiçbir sonucun işaretlemediği karar tablosu kuralı */
    UNCHECKED_RULE,
    /** Doğrulanmayan son koşul */
    UNCOVERED_POST_CONDITION,
    /** Doğrulanmayan alternatif akış */
    UNCOVERED_ALTERNATE_FLOW,
    /** Doğrulanmayan istisna akışı */
    UNCOVERED_EXCEPTION_FLOW
}
