package io.mersel.ucdoc.application.models;

import java.util.List;

/**
 * Tek bir alternatif/istisna akışını hedefleyen sonuçlar için türetilmiş alt karar tablosu.
 *
 * @param variationId Kaynak varyasyon
 * @param branch      Hedef dal
 * @param combination Daraltılmış bağlama ile yeniden üretilen kombinasyon
 * @param table       Alt karar tablosu
 */
public record BranchDecisionTable(String variationId, AltExFlow branch,
                                  PictCombination combination, DecisionTable table) {

    public List<VariationResult> results() {
        return table.resultRows().stream().map(DecisionTable.ResultRow::result).toList();
    }
}
