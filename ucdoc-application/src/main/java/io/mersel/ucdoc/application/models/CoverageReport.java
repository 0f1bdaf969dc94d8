package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.CoverageGapType;

import java.util.List;

/**
 * Esnek kip kapsam doğrulama sonucu.
 */
public record CoverageReport(String useCaseId, List<CoverageWarning> warnings) {

    public CoverageReport {
        warnings = List.copyOf(warnings);
    }

    public boolean isClean() {
        return warnings.isEmpty();
    }

    public List<CoverageWarning> getWarnings(CoverageGapType type) {
        return warnings.stream().filter(w -> w.type() == type).toList();
    }
}
