package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.enums.CoverageGapType;
import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.interfaces.CoverageGapException;
import io.mersel.ucdoc.application.models.CoverageLedger;
import io.mersel.ucdoc.application.models.CoverageReport;
import io.mersel.ucdoc.application.models.CoverageWarning;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.FactorLevelChoice;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VariationResult;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CoverageValidator birim testleri.
 */
@DisplayName("CoverageValidator")
class CoverageValidatorTest {

    private final CartesianCombinationGenerator generator = new CartesianCombinationGenerator();

    private SimpleMeterRegistry registry;
    private DecisionTableBuilder builder;
    private CoverageValidator validator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        UcdocMetrics metrics = new UcdocMetrics(registry);
        builder = new DecisionTableBuilder(metrics);
        validator = new CoverageValidator(metrics);
    }

    private Map<String, DecisionTable> tables(UseCase useCase) {
        Map<String, DecisionTable> tables = new LinkedHashMap<>();
        for (Variation variation : useCase.variations()) {
            tables.put(variation.id(), builder.build(variation));
        }
        return tables;
    }

    @Test
    @DisplayName("Tam kapsanan kullanım senaryosu temiz rapor döner")
    void tam_kapsam() {
        UseCase useCase = TestUseCases.library(generator);

        CoverageReport report = validator.validate(useCase, tables(useCase), ValidationMode.STRICT);

        assertThat(report.isClean()).isTrue();
    }

    @Test
    @DisplayName("Esnek kip: eksik alternatif akış ve işaretsiz kural raporlanır")
    void esnek_kip_uyari() {
        UseCase useCase = TestUseCases.library(generator, List.of(TestUseCases.VR01, TestUseCases.VR03));

        CoverageReport report = validator.validate(useCase, tables(useCase), ValidationMode.LENIENT);

        assertThat(report.warnings()).hasSize(2);
        CoverageWarning rule = report.getWarnings(CoverageGapType.UNCHECKED_RULE).get(0);
        assertThat(rule.variationId()).isEqualTo("V01");
        assertThat(rule.ruleNumbers()).containsExactly(3);
        assertThat(rule.message()).contains("ruleNo=3").contains("decision");
        assertThat(report.getWarnings(CoverageGapType.UNCOVERED_ALTERNATE_FLOW))
                .extracting(CoverageWarning::targetId).containsExactly("A01");
        assertThat(report.getWarnings(CoverageGapType.UNCOVERED_EXCEPTION_FLOW)).isEmpty();
        assertThat(registry.get("ucdoc_coverage_gaps_total").tag("type", "UNCOVERED_ALTERNATE_FLOW")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Katı kip: boşluklar tek istisnada toplanır")
    void kati_kip_istisna() {
        UseCase useCase = TestUseCases.library(generator, List.of(TestUseCases.VR01, TestUseCases.VR03));
        Map<String, DecisionTable> tables = tables(useCase);

        assertThatThrownBy(() -> validator.validate(useCase, tables, ValidationMode.STRICT))
                .isInstanceOfSatisfying(CoverageGapException.class, e -> {
                    assertThat(e.getGaps()).hasSize(2);
                    assertThat(e.getMessage()).contains("UC01");
                });
    }

    @Test
    @DisplayName("Detaylı son koşul yalnızca kendisi de doğrulanırsa kapsanır")
    void detayli_son_kosul() {
        VariationResult detailsOnly = new VariationResult("VR01", "Rezervasyon tamamlanır",
                TestUseCases.VR01.choices(), List.of(TestUseCases.P0101, TestUseCases.P0102));
        UseCase useCase = TestUseCases.library(generator, List.of(detailsOnly, TestUseCases.VR02, TestUseCases.VR03));

        CoverageReport report = validator.validate(useCase, tables(useCase), ValidationMode.LENIENT);

        assertThat(report.getWarnings(CoverageGapType.UNCOVERED_POST_CONDITION))
                .extracting(CoverageWarning::targetId).containsExactly("P01");
    }

    @Test
    @DisplayName("markCoverage tüm sonuçların doğrulama noktalarını toplar")
    void kapsam_defteri() {
        UseCase useCase = TestUseCases.library(generator);

        CoverageLedger ledger = validator.markCoverage(useCase);

        assertThat(ledger.getVerifiedIds()).containsExactlyInAnyOrder("P01", "P0101", "P0102", "A01", "E01");
        assertThat(ledger.isCovered(TestUseCases.A01)).isTrue();
    }

    @Test
    @DisplayName("Tablosu verilmeyen varyasyon kural kontrolünden atlanır")
    void tablosuz_varyasyon() {
        VariationResult partial = new VariationResult("VR09", "Yalnızca var",
                List.of(FactorLevelChoice.of("stock", "var")), List.of(TestUseCases.P01));
        UseCase useCase = TestUseCases.library(generator,
                List.of(partial, TestUseCases.VR01, TestUseCases.VR02, TestUseCases.VR03));

        CoverageReport report = validator.validate(useCase, Map.of(), ValidationMode.LENIENT);

        assertThat(report.getWarnings(CoverageGapType.UNCHECKED_RULE)).isEmpty();
    }
}
