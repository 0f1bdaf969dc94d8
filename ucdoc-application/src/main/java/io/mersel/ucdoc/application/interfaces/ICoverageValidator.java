package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.models.CoverageLedger;
import io.mersel.ucdoc.application.models.CoverageReport;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.UseCase;

import java.util.Map;

/**
 * Karar tablosu kurallarının ve doğrulama noktalarının kapsamını denetler.
 */
public interface ICoverageValidator {

    /**
     * Sonuçlarda doğrulama noktası olarak geçen tüm varlıkları işaretler.
     */
    CoverageLedger markCoverage(UseCase useCase);

    /**
     * @param useCase  Kullanım senaryosu
     * @param tables   Varyasyon id → karar tablosu
     * @param mode     Katı veya esnek kip
     * @return Esnek kipte tespit edilen uyarılar (katı kipte her zaman boş)
     * @throws CoverageGapException Katı kipte en az bir boşluk varsa
     */
    CoverageReport validate(UseCase useCase, Map<String, DecisionTable> tables, ValidationMode mode);
}
