package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.PictCombination;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VariationResult;

import java.util.List;

/**
 * Kombinasyondan koşul/sonuç karar tablosu üretir.
 * Aynı girdiyle her çağrı aynı tabloyu üretir.
 */
public interface IDecisionTableBuilder {

    DecisionTable build(Variation variation);

    /**
     * @param variationId Tabloyu etiketleyen varyasyon id'si
     * @param combination Kapsama
     * @param results     Sonuç satırlarına dönüşecek sonuçlar
     */
    DecisionTable build(String variationId, PictCombination combination, List<VariationResult> results);
}
