package io.mersel.ucdoc.application.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Yükleme sonucu: katalog, kullanım senaryosu başına karar tabloları ve esnek kip uyarıları.
 *
 * @param catalog  Doğrulanmış model
 * @param tables   Kullanım senaryosu id → (varyasyon id → karar tablosu)
 * @param warnings Esnek kipte raporlanan kapsam boşlukları
 */
public record SpecLoadResult(UseCaseCatalog catalog, Map<String, Map<String, DecisionTable>> tables,
                             List<CoverageWarning> warnings) {

    public SpecLoadResult {
        tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        warnings = List.copyOf(warnings);
    }

    public Map<String, DecisionTable> getTables(String useCaseId) {
        return tables.getOrDefault(useCaseId, Map.of());
    }
}
