package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.enums.CoverageGapType;
import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.interfaces.CoverageGapException;
import io.mersel.ucdoc.application.interfaces.ICoverageValidator;
import io.mersel.ucdoc.application.models.AlternateFlow;
import io.mersel.ucdoc.application.models.CoverageLedger;
import io.mersel.ucdoc.application.models.CoverageReport;
import io.mersel.ucdoc.application.models.CoverageWarning;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.ExceptionFlow;
import io.mersel.ucdoc.application.models.PostCondition;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VariationResult;
import io.mersel.ucdoc.application.models.VerificationPoint;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kapsam doğrulayıcı.
 * <p>
 * İki kontrol yapar:
 * <ol>
 *   <li>Her varyasyonun karar tablosunda her kural en az bir sonuçta işaretli olmalı</li>
 *   <li>Her son koşul (her derinlikte), alternatif akış ve istisna akışı en az bir sonuçta doğrulanmalı</li>
 * </ol>
 * Katı kipte tüm boşluklar toplanıp tek bir {@link CoverageGapException} fırlatılır;
 * esnek kipte uyarı olarak döner ve WARN seviyesinde loglanır.
 */
@Service
public class CoverageValidator implements ICoverageValidator {

    private static final Logger log = LoggerFactory.getLogger(CoverageValidator.class);

    static final String UNCHECKED_RULE_HINT =
            "ruleNo değerlerini görmek için 'decision' komutuyla karar tablosunu üretin ve eksik sonucu tanımlayın";
    static final String UNCOVERED_HINT = "verificationPointIds altında bu id'yi doğrulayan bir sonuç ekleyin";

    private final UcdocMetrics metrics;

    public CoverageValidator(UcdocMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public CoverageLedger markCoverage(UseCase useCase) {
        Set<String> verified = new LinkedHashSet<>();
        for (Variation variation : useCase.variations()) {
            for (VariationResult result : variation.results()) {
                for (VerificationPoint point : result.verificationPoints()) {
                    verified.add(point.id());
                }
            }
        }
        return new CoverageLedger(verified);
    }

    @Override
    public CoverageReport validate(UseCase useCase, Map<String, DecisionTable> tables, ValidationMode mode) {
        List<CoverageWarning> gaps = new ArrayList<>();

        for (Variation variation : useCase.variations()) {
            DecisionTable table = tables.get(variation.id());
            if (table == null) {
                continue;
            }
            List<Integer> unchecked = table.getUncheckedRules();
            if (!unchecked.isEmpty()) {
                gaps.add(new CoverageWarning(CoverageGapType.UNCHECKED_RULE, useCase.id(), variation.id(),
                        null, unchecked, UNCHECKED_RULE_HINT));
            }
        }

        CoverageLedger ledger = markCoverage(useCase);
        for (PostCondition postCondition : useCase.getAllPostConditions()) {
            if (!ledger.isCovered(postCondition)) {
                gaps.add(uncovered(CoverageGapType.UNCOVERED_POST_CONDITION, useCase, postCondition.id()));
            }
        }
        for (AlternateFlow alternate : useCase.alternateFlows()) {
            if (!ledger.isCovered(alternate)) {
                gaps.add(uncovered(CoverageGapType.UNCOVERED_ALTERNATE_FLOW, useCase, alternate.id()));
            }
        }
        for (ExceptionFlow exception : useCase.exceptionFlows()) {
            if (!ledger.isCovered(exception)) {
                gaps.add(uncovered(CoverageGapType.UNCOVERED_EXCEPTION_FLOW, useCase, exception.id()));
            }
        }

        gaps.forEach(gap -> metrics.recordCoverageGap(gap.type()));

        if (gaps.isEmpty()) {
            return new CoverageReport(useCase.id(), List.of());
        }
        if (mode == ValidationMode.STRICT) {
            throw new CoverageGapException(useCase.id(), gaps);
        }
        for (CoverageWarning gap : gaps) {
            log.warn("Kapsam uyarısı: {}", gap.message());
        }
        return new CoverageReport(useCase.id(), gaps);
    }

    private CoverageWarning uncovered(CoverageGapType type, UseCase useCase, String targetId) {
        return new CoverageWarning(type, useCase.id(), null, targetId, List.of(), UNCOVERED_HINT);
    }
}
