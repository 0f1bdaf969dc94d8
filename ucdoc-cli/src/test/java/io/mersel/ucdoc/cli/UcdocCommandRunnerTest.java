package io.mersel.ucdoc.cli;

import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.interfaces.IUseCaseSpecLoader;
import io.mersel.ucdoc.application.interfaces.StructuralReferenceException;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.cli.commands.CommandOptions;
import io.mersel.ucdoc.cli.commands.SpecCommand;
import io.mersel.ucdoc.cli.infrastructure.CommandFailureHandler;
import io.mersel.ucdoc.infrastructure.config.UcdocProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * UcdocCommandRunner birim testleri.
 * <p>
 * Yükleyici ve komutlar mock'lanır; argüman çözümleme ve çıkış kodu doğrulanır.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("UcdocCommandRunner")
class UcdocCommandRunnerTest {

    @Mock
    private IUseCaseSpecLoader loader;

    @Mock
    private SpecCommand decision;

    @Mock
    private SpecCommand check;

    private UcdocProperties properties;
    private UcdocCommandRunner runner;

    @BeforeEach
    void setUp() {
        when(decision.name()).thenReturn("decision");
        when(decision.description()).thenReturn("Karar tabloları");
        when(decision.requiresOutput()).thenReturn(true);
        when(check.name()).thenReturn("check");
        when(check.description()).thenReturn("Doğrulama");
        when(check.requiresOutput()).thenReturn(false);
        properties = new UcdocProperties();
        runner = new UcdocCommandRunner(loader, List.of(decision, check), new CommandFailureHandler(), properties);
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    @Nested
    @DisplayName("parse: argüman çözümleme")
    class ParseTests {

        @Test
        @DisplayName("Komut, dosyalar ve çıktı dizini çözülür; varsayılan kip esnektir")
        void tam_argumanlar() {
            CommandOptions options = runner.parse(args("decision", "a.yml", "b.yml", "--output=out"));

            assertThat(options.command()).isEqualTo("decision");
            assertThat(options.files()).containsExactly(Path.of("a.yml"), Path.of("b.yml"));
            assertThat(options.outputDir()).isEqualTo(Path.of("out"));
            assertThat(options.mode()).isEqualTo(ValidationMode.LENIENT);
        }

        @Test
        @DisplayName("Yapılandırmadaki katı kip --lenient ile ezilir")
        void kip_onceligi() {
            properties.getValidation().setStrict(true);

            assertThat(runner.parse(args("check", "a.yml")).mode()).isEqualTo(ValidationMode.STRICT);
            assertThat(runner.parse(args("check", "a.yml", "--lenient")).mode()).isEqualTo(ValidationMode.LENIENT);
        }

        @Test
        @DisplayName("check komutu çıktı dizini istemez")
        void check_ciktisiz() {
            assertThat(runner.parse(args("check", "a.yml", "--strict")).outputDir()).isNull();
        }

        @Test
        @DisplayName("Kullanım hataları IllegalArgumentException fırlatır")
        void kullanim_hatalari() {
            assertThatThrownBy(() -> runner.parse(args()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Kullanım");
            assertThatThrownBy(() -> runner.parse(args("render", "a.yml")))
                    .hasMessageContaining("Bilinmeyen komut: render");
            assertThatThrownBy(() -> runner.parse(args("decision", "--output=out")))
                    .hasMessageContaining("En az bir tanım dosyası");
            assertThatThrownBy(() -> runner.parse(args("decision", "a.yml")))
                    .hasMessageContaining("--output");
            assertThatThrownBy(() -> runner.parse(args("check", "a.yml", "--strict", "--lenient")))
                    .hasMessageContaining("birlikte");
        }
    }

    @Nested
    @DisplayName("run: çıkış kodu")
    class RunTests {

        @Test
        @DisplayName("Başarılı komut 0 döner")
        void basarili() throws Exception {
            SpecLoadResult spec = mock(SpecLoadResult.class);
            when(loader.load(any(), any())).thenReturn(spec);
            when(decision.execute(any(), any())).thenReturn(List.of(Path.of("out/UC01-V01.decision.md")));

            runner.run(args("decision", "a.yml", "--output=out", "--strict"));

            assertThat(runner.getExitCode()).isZero();
            verify(loader).load(List.of(Path.of("a.yml")), ValidationMode.STRICT);
            verify(decision).execute(spec, new CommandOptions("decision", List.of(Path.of("a.yml")),
                    Path.of("out"), ValidationMode.STRICT));
        }

        @Test
        @DisplayName("Tanım hatası 2 döner ve komut çalışmaz")
        void tanim_hatasi() throws Exception {
            when(loader.load(any(), any())).thenThrow(new StructuralReferenceException("actors", "eksik"));

            runner.run(args("decision", "a.yml", "--output=out"));

            assertThat(runner.getExitCode()).isEqualTo(CommandFailureHandler.SPEC_ERROR);
            verify(decision, never()).execute(any(), any());
        }

        @Test
        @DisplayName("Kullanım hatası 1 döner ve yükleme yapılmaz")
        void kullanim_hatasi() throws Exception {
            runner.run(args("decision", "a.yml"));

            assertThat(runner.getExitCode()).isEqualTo(CommandFailureHandler.USAGE_ERROR);
            verify(loader, never()).load(any(), any());
        }
    }
}
