package io.mersel.ucdoc.cli.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Çıktı dosyası yazma yardımcısı.
 */
final class OutputFiles {

    private static final Logger log = LoggerFactory.getLogger(OutputFiles.class);

    private OutputFiles() {
    }

    static Path write(Path outputDir, String fileName, String content) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.info("  → {} yazıldı", target);
        return target;
    }
}
