package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.application.interfaces.StructuralReferenceException;
import io.mersel.ucdoc.application.models.Actor;
import io.mersel.ucdoc.application.models.Glossary;
import io.mersel.ucdoc.application.models.GlossaryCatalog;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.AppProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ConditionProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.FlowProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ScenarioProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.UseCaseProps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * KeywordResolver birim testleri.
 */
@DisplayName("KeywordResolver")
class KeywordResolverTest {

    private static final Glossary BOOK = new Glossary("G01", "book", "Kitap", null, null);
    private static final Glossary LOAN = new Glossary("G01", "loan", "Ödünç", null, null);
    private static final Glossary SHELF = new Glossary("G03", "place", "Raf", null, null);

    private final KeywordResolver resolver = new KeywordResolver(
            new GlossaryCatalog(List.of(BOOK, LOAN, SHELF)), List.of(new Actor("U01", "Üye")), "<%s>");

    private static AppProps app(String summary, String flowDescription) {
        UseCaseProps useCase = new UseCaseProps("Rezervasyon", summary,
                Map.of("R01", new ConditionProps("${U01} giriş yapmış", Map.of())),
                Map.of(),
                Map.of("B01", new FlowProps("U01", flowDescription)),
                Map.of(), Map.of(), Map.of());
        return new AppProps(Map.of(), Map.of(), Map.of(), Map.of("UC01", useCase),
                Map.of("BS01", new ScenarioProps("${place/G03} turu", null, List.of("UC01"))));
    }

    @Test
    @DisplayName("Kategorili ve kategorisiz anahtar kelimeler biçimle değiştirilir")
    void degistirme() {
        KeywordResolver.Resolution resolution = resolver.resolve(app("${book/G01} ayırtılır", "${U01} ${G03} üzerinde arar"));

        UseCaseProps useCase = resolution.props().usecases().get("UC01");
        assertThat(useCase.summary()).isEqualTo("<G01> ayırtılır");
        assertThat(useCase.basicFlows().get("B01").description()).isEqualTo("<U01> <G03> üzerinde arar");
        assertThat(useCase.preConditions().get("R01").description()).isEqualTo("<U01> giriş yapmış");
        assertThat(resolution.props().scenarios().get("BS01").name()).isEqualTo("<G03> turu");
    }

    @Test
    @DisplayName("Kullanım senaryosunda geçen sözlük terimleri toplanır, aktörler toplanmaz")
    void terim_toplama() {
        KeywordResolver.Resolution resolution = resolver.resolve(app("${loan/G01}", "${U01} ${G03} arar"));

        assertThat(resolution.glossariesByUseCase().get("UC01")).containsExactly(LOAN, SHELF);
    }

    @Test
    @DisplayName("id ve referans alanları değişmez")
    void referanslar_korunur() {
        KeywordResolver.Resolution resolution = resolver.resolve(app("özet", "açıklama"));

        assertThat(resolution.props().usecases().get("UC01").basicFlows().get("B01").playerId()).isEqualTo("U01");
        assertThat(resolution.props().scenarios().get("BS01").usecaseOrder()).containsExactly("UC01");
    }

    @Test
    @DisplayName("Bilinmeyen anahtar kelime yol bilgisiyle reddedilir")
    void bilinmeyen_anahtar() {
        assertThatThrownBy(() -> resolver.resolve(app("${book/G99}", "açıklama")))
                .isInstanceOf(StructuralReferenceException.class)
                .hasMessageContaining("usecases.UC01.summary")
                .hasMessageContaining("${book/G99}");
    }

    @Test
    @DisplayName("Kategori uyuşmazlığı bilinmeyen sayılır")
    void kategori_uyusmazligi() {
        assertThatThrownBy(() -> resolver.resolve(app("${place/G01}", "açıklama")))
                .isInstanceOf(StructuralReferenceException.class);
    }
}
