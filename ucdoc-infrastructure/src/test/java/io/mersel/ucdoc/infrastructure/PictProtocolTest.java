package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.interfaces.AdapterProtocolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PictProtocol birim testleri.
 */
@DisplayName("PictProtocol")
class PictProtocolTest {

    @Nested
    @DisplayName("encodeRequest: istek metni")
    class EncodeTests {

        @Test
        @DisplayName("Faktör başına konumsal belirteç satırı yazılır")
        void konumsal_belirtecler() {
            String request = PictProtocol.encodeRequest(List.of(2, 3), "");

            assertThat(request).isEqualTo("f0: i0, i1\nf1: i0, i1, i2\n");
        }

        @Test
        @DisplayName("Kısıt metni boş satırdan sonra aynen eklenir")
        void kisit_aynen_eklenir() {
            String request = PictProtocol.encodeRequest(List.of(2, 2), "IF [f0] = \"i0\" THEN [f1] = \"i1\";");

            assertThat(request).isEqualTo("f0: i0, i1\nf1: i0, i1\n\nIF [f0] = \"i0\" THEN [f1] = \"i1\";\n");
        }

        @Test
        @DisplayName("Null kısıt eklenmez")
        void null_kisit() {
            assertThat(PictProtocol.encodeRequest(List.of(1), null)).isEqualTo("f0: i0\n");
        }
    }

    @Nested
    @DisplayName("decodeResponse: çıktı çözümleme")
    class DecodeTests {

        @Test
        @DisplayName("Başlık ve satırlar seviye indekslerine çözülür")
        void gecerli_cikti() {
            List<int[]> rows = PictProtocol.decodeResponse("f0\tf1\ni1\ti0\ni0\ti2\n\n", List.of(2, 3));

            assertThat(rows).hasSize(2);
            assertThat(rows.get(0)).containsExactly(1, 0);
            assertThat(rows.get(1)).containsExactly(0, 2);
        }

        @Test
        @DisplayName("Boş çıktı hata verir")
        void bos_cikti() {
            assertThatThrownBy(() -> PictProtocol.decodeResponse("\n", List.of(2)))
                    .isInstanceOf(AdapterProtocolException.class)
                    .hasMessageContaining("boş");
        }

        @Test
        @DisplayName("Başlık sütun sayısı uyuşmazlığı hata verir")
        void baslik_sutun_sayisi() {
            assertThatThrownBy(() -> PictProtocol.decodeResponse("f0\ni0\n", List.of(2, 2)))
                    .isInstanceOf(AdapterProtocolException.class)
                    .hasMessageContaining("başlık");
        }

        @Test
        @DisplayName("Beklenmeyen başlık adı hata verir")
        void baslik_adi() {
            assertThatThrownBy(() -> PictProtocol.decodeResponse("f1\tf0\ni0\ti0\n", List.of(2, 2)))
                    .isInstanceOf(AdapterProtocolException.class);
        }

        @Test
        @DisplayName("Eksik sütunlu satır hata verir")
        void satir_sutun_sayisi() {
            assertThatThrownBy(() -> PictProtocol.decodeResponse("f0\tf1\ni0\n", List.of(2, 2)))
                    .isInstanceOf(AdapterProtocolException.class)
                    .hasMessageContaining("sütun sayısı");
        }

        @Test
        @DisplayName("Tanınmayan belirteç hata verir")
        void taninmayan_belirtec() {
            assertThatThrownBy(() -> PictProtocol.decodeResponse("f0\nvar\n", List.of(2)))
                    .isInstanceOf(AdapterProtocolException.class)
                    .hasMessageContaining("var");
            assertThatThrownBy(() -> PictProtocol.decodeResponse("f0\nix\n", List.of(2)))
                    .isInstanceOf(AdapterProtocolException.class);
        }

        @Test
        @DisplayName("Aralık dışı indeks hata verir")
        void aralik_disi() {
            assertThatThrownBy(() -> PictProtocol.decodeResponse("f0\ni2\n", List.of(2)))
                    .isInstanceOf(AdapterProtocolException.class)
                    .hasMessageContaining("aralık dışında");
        }

        @Test
        @DisplayName("Yalnızca başlık varsa hata verir")
        void kural_yok() {
            assertThatThrownBy(() -> PictProtocol.decodeResponse("f0\tf1\n", List.of(2, 2)))
                    .isInstanceOf(AdapterProtocolException.class)
                    .hasMessageContaining("kural");
        }
    }
}
