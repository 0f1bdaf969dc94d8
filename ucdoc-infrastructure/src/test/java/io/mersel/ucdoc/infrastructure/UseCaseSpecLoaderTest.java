package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.enums.CoverageGapType;
import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.interfaces.CoverageGapException;
import io.mersel.ucdoc.application.interfaces.DuplicateFactorBindingException;
import io.mersel.ucdoc.application.interfaces.StructuralReferenceException;
import io.mersel.ucdoc.application.interfaces.UniquenessViolationException;
import io.mersel.ucdoc.application.models.AlternateFlow;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.FactorLevelChoice;
import io.mersel.ucdoc.application.models.Glossary;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.infrastructure.config.UcdocProperties;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import io.mersel.ucdoc.infrastructure.yaml.SpecAssembly;
import io.mersel.ucdoc.infrastructure.yaml.SpecPropsReader;
import io.mersel.ucdoc.infrastructure.yaml.SpecYamlReader;
import io.mersel.ucdoc.infrastructure.yaml.UseCaseAssembler;
import io.mersel.ucdoc.infrastructure.yaml.VariationAssembler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UseCaseSpecLoader entegrasyon testleri.
 * <p>
 * Tüm bileşenler gerçek; yalnızca PICT yerine kartezyen üretici kullanılır.
 */
@DisplayName("UseCaseSpecLoader")
class UseCaseSpecLoaderTest {

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private CartesianCombinationGenerator generator;
    private UseCaseSpecLoader loader;
    private Path common;

    @BeforeEach
    void setUp() throws URISyntaxException {
        registry = new SimpleMeterRegistry();
        generator = new CartesianCombinationGenerator();
        UcdocMetrics metrics = new UcdocMetrics(registry);
        loader = new UseCaseSpecLoader(
                new SpecYamlReader(),
                new SpecPropsReader(),
                new SpecAssembly(new UseCaseAssembler(new VariationAssembler(generator))),
                new DecisionTableBuilder(metrics),
                new CoverageValidator(metrics),
                new UcdocProperties(),
                metrics);
        common = resource("/specs/common.yml");
    }

    private Path resource(String name) throws URISyntaxException {
        return Path.of(getClass().getResource(name).toURI());
    }

    private Path write(String content) throws IOException {
        return Files.writeString(tempDir.resolve("uc.yml"), content);
    }

    @Nested
    @DisplayName("Geçerli tanım")
    class ValidSpec {

        private SpecLoadResult result;
        private UseCase useCase;

        @BeforeEach
        void load() throws Exception {
            result = loader.load(List.of(common, resource("/specs/library.yml")), ValidationMode.STRICT);
            useCase = result.catalog().findUseCase("UC01").orElseThrow();
        }

        @Test
        @DisplayName("Birden fazla dosya tek katalogda birleşir")
        void katalog() {
            assertThat(result.catalog().actors()).hasSize(2);
            assertThat(result.catalog().factors()).hasSize(2);
            assertThat(result.catalog().scenarios()).singleElement()
                    .satisfies(s -> assertThat(s.useCaseOrder()).containsExactly(useCase));
            assertThat(result.warnings()).isEmpty();
            assertThat(registry.get("ucdoc_usecases_loaded_total").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Anahtar kelimeler çözülür ve geçen sözlük terimleri toplanır")
        void anahtar_kelimeler() {
            assertThat(useCase.summary()).isEqualTo("「U01」 bir 「G01」 rezerve eder");
            assertThat(useCase.glossaries()).extracting(Glossary::id).containsExactly("G01", "G02");
            assertThat(useCase.postConditions().get(0).details()).hasSize(2);
        }

        @Test
        @DisplayName("Dallar kaynak ve dönüş adımlarıyla bağlanır")
        void dallar() {
            AlternateFlow a01 = useCase.alternateFlows().get(0);
            assertThat(a01.sourceFlows()).extracting(f -> f.id()).containsExactly("B02");
            assertThat(a01.returnFlow().id()).isEqualTo("B03");
            assertThat(a01.nextFlows()).extracting(f -> f.id()).containsExactly("A0101");
            assertThat(useCase.links().hasBranches("B02")).isTrue();
            assertThat(useCase.links().hasBackLink("B03")).isTrue();
        }

        @Test
        @DisplayName("arrow/disarrow ve takma adlar çözülür")
        void sonuclar() {
            Variation v01 = useCase.findVariation("V01").orElseThrow();

            assertThat(v01.findResult("VR02").orElseThrow().description()).isEqualTo("Bekleme listesine alınır");
            assertThat(v01.findResult("VR02").orElseThrow().verificationPoints())
                    .extracting(vp -> vp.id()).containsExactly("A01");
            assertThat(v01.findResult("VR03").orElseThrow().choices())
                    .containsExactly(FactorLevelChoice.of("member", "pasif"));
        }

        @Test
        @DisplayName("Karar tablosu her varyasyon için kurulur")
        void karar_tablosu() {
            DecisionTable table = result.getTables("UC01").get("V01");

            assertThat(table.ruleCount()).isEqualTo(4);
            assertThat(table.getUncheckedRules()).isEmpty();
            assertThat(generator.getConstraints()).containsExactly("");
        }
    }

    @Nested
    @DisplayName("Hatalı tanım")
    class InvalidSpec {

        private static final String HEADER = """
                usecases:
                  UC01:
                    name: Deneme
                    preConditions:
                      R01: Ön koşul
                    postConditions:
                      P01: Son koşul
                """;

        private static final String VARIATION = """
                    valiations:
                      V01:
                        factorEntryPoints:
                          B01:
                            factors: [stock]
                        results:
                          VR01:
                            description: Tamamlanır
                            verificationPointIds: [P01]
                """;

        @Test
        @DisplayName("Akış id'si ön koşul id'siyle çakışırsa yükleme durur")
        void id_cakismasi() throws IOException {
            Path file = write(HEADER + """
                    basicFlows:
                      R01:
                        playerId: U01
                        description: Çakışan adım
                """);

            assertThatThrownBy(() -> loader.load(List.of(common, file), ValidationMode.LENIENT))
                    .isInstanceOfSatisfying(UniquenessViolationException.class,
                            e -> assertThat(e.getDuplicateId()).isEqualTo("R01"))
                    .hasMessageContaining("usecases.UC01.basicFlows.R01");
        }

        @Test
        @DisplayName("Tanımsız oyuncu yol bilgisiyle raporlanır")
        void tanimsiz_oyuncu() throws IOException {
            Path file = write(HEADER + """
                    basicFlows:
                      B01:
                        playerId: X99
                """);

            assertThatThrownBy(() -> loader.load(List.of(common, file), ValidationMode.LENIENT))
                    .isInstanceOf(StructuralReferenceException.class)
                    .hasMessageContaining("usecases.UC01.basicFlows.B01.playerId")
                    .hasMessageContaining("X99");
        }

        @Test
        @DisplayName("Tanımsız doğrulama noktası reddedilir")
        void tanimsiz_dogrulama_noktasi() throws IOException {
            Path file = write(HEADER + """
                    basicFlows:
                      B01:
                        playerId: U01
                """ + VARIATION.replace("[P01]", "[P99]"));

            assertThatThrownBy(() -> loader.load(List.of(common, file), ValidationMode.LENIENT))
                    .isInstanceOf(StructuralReferenceException.class)
                    .hasMessageContaining("P99");
        }

        @Test
        @DisplayName("Aynı faktör iki giriş noktasına bağlanamaz")
        void cift_baglama() throws IOException {
            Path file = write(HEADER + """
                    basicFlows:
                      B01:
                        playerId: U01
                    valiations:
                      V01:
                        factorEntryPoints:
                          B01:
                            factors: [stock]
                          R01:
                            factors: [stock]
                        results:
                          VR01:
                            verificationPointIds: [P01]
                """);

            assertThatThrownBy(() -> loader.load(List.of(common, file), ValidationMode.LENIENT))
                    .isInstanceOf(DuplicateFactorBindingException.class)
                    .hasMessageContaining("stock");
        }

        @Test
        @DisplayName("İstisna akışı dönüş adımı tanımlayamaz")
        void istisna_donus() throws IOException {
            Path file = write(HEADER + """
                    basicFlows:
                      B01:
                        playerId: U01
                    exceptionFlows:
                      E01:
                        override:
                          B01:
                            returnFlowId: B01
                """);

            assertThatThrownBy(() -> loader.load(List.of(common, file), ValidationMode.LENIENT))
                    .isInstanceOf(StructuralReferenceException.class)
                    .hasMessageContaining("returnFlowId");
        }

        @Test
        @DisplayName("Kapsam boşluğu esnek kipte uyarı, katı kipte hata olur")
        void kapsam_boslugu() throws IOException {
            Path file = write(HEADER + """
                    basicFlows:
                      B01:
                        playerId: U01
                    valiations:
                      V01:
                        factorEntryPoints:
                          B01:
                            factors: [stock]
                        results:
                          VR01:
                            arrow:
                              stock: [var]
                            verificationPointIds: [P01]
                """);

            SpecLoadResult lenient = loader.load(List.of(common, file), ValidationMode.LENIENT);
            assertThat(lenient.warnings()).singleElement().satisfies(w -> {
                assertThat(w.type()).isEqualTo(CoverageGapType.UNCHECKED_RULE);
                assertThat(w.ruleNumbers()).containsExactly(2);
            });

            assertThatThrownBy(() -> loader.load(List.of(common, file), ValidationMode.STRICT))
                    .isInstanceOf(CoverageGapException.class)
                    .hasMessageContaining("ruleNo=2");
        }
    }
}
