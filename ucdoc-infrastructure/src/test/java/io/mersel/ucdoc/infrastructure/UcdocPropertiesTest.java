package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.infrastructure.config.UcdocProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * UcdocProperties birim testleri.
 * <p>
 * @PostConstruct validate() metodunun geçersiz değerleri varsayılana
 * geri döndürdüğünü ve komut satırı ayrıştırmasını test eder.
 */
@DisplayName("UcdocProperties")
class UcdocPropertiesTest {

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("validate_gecerli_degerler: valid values unchanged")
        void validate_gecerli_degerler() throws Exception {
            var props = new UcdocProperties();
            props.getPict().setCommand("/opt/pict/pict /o:3");
            props.getPict().setTimeoutMs(5000);
            props.getKeyword().setReplacementFormat("**%s**");

            invokeValidate(props);

            assertThat(props.getPict().getCommand()).isEqualTo("/opt/pict/pict /o:3");
            assertThat(props.getPict().getTimeoutMs()).isEqualTo(5000);
            assertThat(props.getKeyword().getReplacementFormat()).isEqualTo("**%s**");
        }

        @ParameterizedTest(name = "timeout = {0}")
        @ValueSource(longs = {0, -1, -60000})
        @DisplayName("validate_pozitif_olmayan_timeout: resets to default 60000")
        void validate_pozitif_olmayan_timeout(long timeoutMs) throws Exception {
            var props = new UcdocProperties();
            props.getPict().setTimeoutMs(timeoutMs);

            invokeValidate(props);

            assertThat(props.getPict().getTimeoutMs()).isEqualTo(60000);
        }

        @ParameterizedTest(name = "command = ''{0}''")
        @ValueSource(strings = {"", "   ", "\t"})
        @DisplayName("validate_bos_komut: blank command resets to 'pict'")
        void validate_bos_komut(String command) throws Exception {
            var props = new UcdocProperties();
            props.getPict().setCommand(command);

            invokeValidate(props);

            assertThat(props.getPict().getCommand()).isEqualTo("pict");
        }

        @Test
        @DisplayName("validate_null_komut: null command resets to 'pict'")
        void validate_null_komut() throws Exception {
            var props = new UcdocProperties();
            props.getPict().setCommand(null);

            invokeValidate(props);

            assertThat(props.getPict().getCommand()).isEqualTo("pict");
        }

        @ParameterizedTest(name = "format = ''{0}''")
        @ValueSource(strings = {"[id]", "「%s」 %d", "%s 100%", "%s %s"})
        @DisplayName("validate_kullanilamaz_bicim: unusable keyword format resets to default")
        void validate_kullanilamaz_bicim(String format) throws Exception {
            var props = new UcdocProperties();
            props.getKeyword().setReplacementFormat(format);

            invokeValidate(props);

            assertThat(props.getKeyword().getReplacementFormat()).isEqualTo("「%s」");
        }

        @Test
        @DisplayName("validate_null_bicim: null keyword format resets to default")
        void validate_null_bicim() throws Exception {
            var props = new UcdocProperties();
            props.getKeyword().setReplacementFormat(null);

            invokeValidate(props);

            assertThat(props.getKeyword().getReplacementFormat()).isEqualTo("「%s」");
        }
    }

    @Nested
    @DisplayName("getCommandLine")
    class CommandLine {

        @Test
        @DisplayName("Boşluklarla ayrılır, fazla boşluk yok sayılır")
        void bosluk_ayirici() {
            var props = new UcdocProperties();
            props.getPict().setCommand("  pict   /o:2 /r ");

            assertThat(props.getPict().getCommandLine()).containsExactly("pict", "/o:2", "/r");
        }

        @Test
        @DisplayName("Tırnak içindeki boşluk ayırıcı sayılmaz")
        void tirnakli_parca() {
            var props = new UcdocProperties();
            props.getPict().setCommand("\"C:\\Program Files\\PICT\\pict.exe\" '/o:3' /c");

            assertThat(props.getPict().getCommandLine())
                    .containsExactly("C:\\Program Files\\PICT\\pict.exe", "/o:3", "/c");
        }

        @Test
        @DisplayName("Varsayılan komut tek parçadır")
        void varsayilan_komut() {
            assertThat(new UcdocProperties().getPict().getCommandLine()).containsExactly("pict");
        }
    }

    @Test
    @DisplayName("varsayilan_degerler: defaults are usable")
    void varsayilan_degerler() {
        var props = new UcdocProperties();

        assertThat(props.getPict().getTimeoutMs()).isGreaterThan(0);
        assertThat(props.getPict().getCommand()).isEqualTo("pict");
        assertThat(props.getKeyword().getReplacementFormat()).isEqualTo("「%s」");
        assertThat(props.getValidation().isStrict()).isFalse();
    }

    private void invokeValidate(UcdocProperties props) throws Exception {
        Method validate = UcdocProperties.class.getDeclaredMethod("validate");
        validate.setAccessible(true);
        validate.invoke(props);
    }
}
