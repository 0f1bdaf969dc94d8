package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.ConditionMark;
import io.mersel.ucdoc.application.enums.ResultMark;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Koşul/sonuç karar tablosu.
 * <p>
 * Kombinasyondan türetilir ve değiştirilmez. Kural numaraları 1 tabanlıdır.
 *
 * @param variationId   Kaynak varyasyon
 * @param ruleCount     Kural (sütun) sayısı
 * @param conditionRows Faktör seviyesi başına bir satır
 * @param resultRows    Varyasyon sonucu başına bir satır
 */
public record DecisionTable(String variationId, int ruleCount,
                            List<ConditionRow> conditionRows, List<ResultRow> resultRows) {

    public DecisionTable {
        conditionRows = List.copyOf(conditionRows);
        resultRows = List.copyOf(resultRows);
    }

    /**
     * Koşul satırı: (faktör, seviye) ve kural başına YES/NONE işaretleri.
     */
    public record ConditionRow(Factor factor, FactorLevel level, String entryPointId, List<ConditionMark> marks) {

        public ConditionRow {
            Objects.requireNonNull(factor, "factor");
            Objects.requireNonNull(level, "level");
            marks = List.copyOf(marks);
        }

        public FactorLevelChoice choice() {
            return new FactorLevelChoice(factor.id(), level);
        }
    }

    /**
     * Sonuç satırı: varyasyon sonucu ve kural başına CHECK/NONE işaretleri.
     */
    public record ResultRow(VariationResult result, List<ResultMark> marks) {

        public ResultRow {
            Objects.requireNonNull(result, "result");
            marks = List.copyOf(marks);
        }
    }

    /**
     * @param ruleNo 1 tabanlı kural numarası
     * @return Kuralda YES işaretli seçimler
     */
    public List<FactorLevelChoice> getRuleConditions(int ruleNo) {
        checkRule(ruleNo);
        return conditionRows.stream()
                .filter(row -> row.marks().get(ruleNo - 1) == ConditionMark.YES)
                .map(ConditionRow::choice)
                .toList();
    }

    /**
     * @param ruleNo 1 tabanlı kural numarası
     * @return Kuralda CHECK işaretli sonuçlar
     */
    public List<VariationResult> getRuleResults(int ruleNo) {
        checkRule(ruleNo);
        return resultRows.stream()
                .filter(row -> row.marks().get(ruleNo - 1) == ResultMark.CHECK)
                .map(ResultRow::result)
                .toList();
    }

    public List<ConditionRow> getConditionRowsByEntryPoint(String entryPointId) {
        return conditionRows.stream()
                .filter(row -> row.entryPointId().equals(entryPointId))
                .toList();
    }

    /**
     * @return Hiçbir sonucun işaretlemediği kural numaraları (1 tabanlı)
     */
    public List<Integer> getUncheckedRules() {
        List<Integer> unchecked = new ArrayList<>();
        for (int ruleNo = 1; ruleNo <= ruleCount; ruleNo++) {
            if (getRuleResults(ruleNo).isEmpty()) {
                unchecked.add(ruleNo);
            }
        }
        return unchecked;
    }

    private void checkRule(int ruleNo) {
        if (ruleNo < 1 || ruleNo > ruleCount) {
            throw new IndexOutOfBoundsException("Kural numarası 1.." + ruleCount + " aralığında olmalı: " + ruleNo);
        }
    }
}
