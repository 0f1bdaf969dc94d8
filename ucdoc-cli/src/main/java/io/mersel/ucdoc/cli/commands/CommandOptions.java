package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.enums.ValidationMode;

import java.nio.file.Path;
import java.util.List;

/**
 * Komut satırından çözümlenen seçenekler.
 *
 * @param command   Komut adı
 * @param files     Tanım dosyaları
 * @param outputDir Çıktı dizini ({@code check} komutunda null olabilir)
 * @param mode      Kapsam doğrulama kipi
 */
public record CommandOptions(String command, List<Path> files, Path outputDir, ValidationMode mode) {

    public CommandOptions {
        files = List.copyOf(files);
    }
}
