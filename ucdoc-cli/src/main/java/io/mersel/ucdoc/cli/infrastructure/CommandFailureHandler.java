package io.mersel.ucdoc.cli.infrastructure;

import io.mersel.ucdoc.application.interfaces.AdapterProtocolException;
import io.mersel.ucdoc.application.interfaces.CoverageGapException;
import io.mersel.ucdoc.application.interfaces.SpecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Komut hatalarını loglar ve süreç çıkış koduna çevirir.
 * <ul>
 *   <li>{@code 1}: kullanım hatası veya beklenmeyen hata</li>
 *   <li>{@code 2}: tanım hatası (yapısal referans, id tekilliği, faktör bağlama)</li>
 *   <li>{@code 3}: katı kipte kapsam boşluğu</li>
 *   <li>{@code 4}: kombinasyon üreticisi hatası</li>
 *   <li>{@code 5}: dosya okuma/yazma hatası</li>
 * </ul>
 */
@Component
public class CommandFailureHandler {

    private static final Logger log = LoggerFactory.getLogger(CommandFailureHandler.class);

    public static final int USAGE_ERROR = 1;
    public static final int SPEC_ERROR = 2;
    public static final int COVERAGE_ERROR = 3;
    public static final int GENERATOR_ERROR = 4;
    public static final int IO_ERROR = 5;

    public int handle(Exception ex) {
        if (ex instanceof CoverageGapException gap) {
            log.error("Kapsam doğrulaması başarısız ({} boşluk)", gap.getGaps().size());
            gap.getGaps().forEach(g -> log.error("  {}", g.message()));
            return COVERAGE_ERROR;
        }
        if (ex instanceof SpecException) {
            log.error("Tanım hatası: {}", ex.getMessage());
            return SPEC_ERROR;
        }
        if (ex instanceof AdapterProtocolException) {
            log.error("Kombinasyon üreticisi hatası: {}", ex.getMessage());
            return GENERATOR_ERROR;
        }
        if (ex instanceof IOException || ex instanceof UncheckedIOException) {
            log.error("Dosya hatası: {}", ex.getMessage());
            return IO_ERROR;
        }
        if (ex instanceof IllegalArgumentException) {
            log.error("Kullanım hatası: {}", ex.getMessage());
            return USAGE_ERROR;
        }
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        return USAGE_ERROR;
    }
}
