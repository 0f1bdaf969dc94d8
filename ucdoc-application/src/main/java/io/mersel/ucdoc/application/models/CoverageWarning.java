package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.CoverageGapType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Kapsam boşluğu.
 *
 * @param type        Boşluk türü
 * @param useCaseId   Kullanım senaryosu
 * @param variationId Varyasyon (yalnızca {@link CoverageGapType#UNCHECKED_RULE} için, diğerlerinde null)
 * @param targetId    Kapsanmayan varlık id'si (kural boşluğunda null)
 * @param ruleNumbers İşaretsiz kural numaraları (1 tabanlı)
 * @param hint        Çözüm önerisi
 */
public record CoverageWarning(CoverageGapType type, String useCaseId, String variationId, String targetId,
                              List<Integer> ruleNumbers, String hint) {

    public CoverageWarning {
        ruleNumbers = ruleNumbers == null ? List.of() : List.copyOf(ruleNumbers);
        hint = hint == null ? "" : hint;
    }

    public String message() {
        String text = switch (type) {
            case UNCHECKED_RULE -> "usecases." + useCaseId + ".valiations." + variationId
                    + ": ruleNo=" + ruleNumbers.stream().map(String::valueOf).collect(Collectors.joining(","))
                    + " için hiçbir sonuç işaretlenmemiş";
            case UNCOVERED_POST_CONDITION -> "usecases." + useCaseId + ": son koşul " + targetId
                    + " hiçbir sonuçta doğrulanmıyor";
            case UNCOVERED_ALTERNATE_FLOW -> "usecases." + useCaseId + ": alternatif akış " + targetId
                    + " hiçbir sonuçta doğrulanmıyor";
            case UNCOVERED_EXCEPTION_FLOW -> "usecases." + useCaseId + ": istisna akışı " + targetId
                    + " hiçbir sonuçta doğrulanmıyor";
        };
        return hint.isEmpty() ? text : text + " (" + hint + ")";
    }
}
