package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.interfaces.IBranchDecisionTableDeriver;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.infrastructure.ScenarioFlowDeriver;
import io.mersel.ucdoc.infrastructure.ScenarioStepIdRegistry;
import io.mersel.ucdoc.infrastructure.ScenarioTableProjector;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import io.mersel.ucdoc.infrastructure.output.CombinationMarkdownWriter;
import io.mersel.ucdoc.infrastructure.output.DecisionTableMarkdownWriter;
import io.mersel.ucdoc.infrastructure.output.UseCaseMarkdownWriter;
import io.mersel.ucdoc.infrastructure.output.UseCaseTestDocumentWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Dosya yazan komutların birim testleri.
 */
@DisplayName("SpecCommand")
class SpecCommandsTest {

    @TempDir
    Path outputDir;

    private SpecLoadResult spec;
    private CommandOptions options;

    @BeforeEach
    void setUp() {
        spec = CommandFixtures.payment();
        options = new CommandOptions("x", List.of(Path.of("spec.yml")), outputDir.resolve("out"), ValidationMode.LENIENT);
    }

    @Test
    @DisplayName("pict: varyasyon başına .pict.md yazılır")
    void pict() throws Exception {
        List<Path> written = new PictCommand(new CombinationMarkdownWriter()).execute(spec, options);

        assertThat(written).containsExactly(outputDir.resolve("out/UC01-V01.pict.md"));
        assertThat(Files.readString(written.get(0))).contains("| 2 | 100 |");
    }

    @Test
    @DisplayName("decision: her dal için alt tablo istenir")
    void decision() throws Exception {
        IBranchDecisionTableDeriver deriver = mock(IBranchDecisionTableDeriver.class);
        when(deriver.derive(any(), any())).thenReturn(Optional.empty());

        List<Path> written = new DecisionCommand(new DecisionTableMarkdownWriter(), deriver).execute(spec, options);

        assertThat(written).containsExactly(outputDir.resolve("out/UC01-V01.decision.md"));
        assertThat(Files.readString(written.get(0))).contains("| Sonuç | E01 | VR02 | Reddedilir | X |  |");
        verify(deriver, times(1)).derive(any(), any());
    }

    @Test
    @DisplayName("uctest: kullanım senaryosu başına .uctest.json yazılır")
    void uctest() throws Exception {
        UcdocMetrics metrics = new UcdocMetrics(new SimpleMeterRegistry());
        UcTestCommand command = new UcTestCommand(new ScenarioFlowDeriver(),
                new ScenarioTableProjector(new ScenarioStepIdRegistry(metrics)), new UseCaseTestDocumentWriter());

        List<Path> written = command.execute(spec, options);

        assertThat(written).containsExactly(outputDir.resolve("out/UC01.uctest.json"));
        String json = Files.readString(written.get(0));
        assertThat(json).contains("\"scenarioId\" : \"TP02\"").contains("\"branchType\" : \"EXCEPTION\"");
    }

    @Test
    @DisplayName("ucmd: kullanım senaryosu başına .md tanım dokümanı yazılır")
    void ucmd() throws Exception {
        List<Path> written = new UseCaseCommand(new UseCaseMarkdownWriter()).execute(spec, options);

        assertThat(written).containsExactly(outputDir.resolve("out/UC01.md"));
        assertThat(Files.readString(written.get(0)))
                .startsWith("---\nid: UC01\nname: Ödeme\n---\n")
                .contains("- <a name=\"B01\">B01</a>: [Müşteri](#U01) Müşteri tutarı girer ([E01][])")
                .contains("[B01]: #B01");
    }

    @Test
    @DisplayName("check: dosya yazmaz")
    void check() {
        CheckCommand command = new CheckCommand();

        assertThat(command.requiresOutput()).isFalse();
        assertThat(command.execute(spec, options)).isEmpty();
        assertThat(Files.exists(outputDir.resolve("out"))).isFalse();
    }
}
