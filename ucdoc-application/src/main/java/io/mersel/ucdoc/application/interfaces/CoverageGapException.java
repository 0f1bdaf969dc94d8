package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.models.CoverageWarning;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Katı kipte kapsam doğrulaması başarısız olduğunda fırlatılır.
 * Tespit edilen tüm boşlukları birlikte taşır.
 */
public class CoverageGapException extends SpecException {

    private final List<CoverageWarning> gaps;

    public CoverageGapException(String useCaseId, List<CoverageWarning> gaps) {
        super("usecases." + useCaseId, "kapsam doğrulaması başarısız:\n" + gaps.stream()
                .map(CoverageWarning::message)
                .collect(Collectors.joining("\n")));
        this.gaps = List.copyOf(gaps);
    }

    public List<CoverageWarning> getGaps() {
        return gaps;
    }
}
