package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.models.SpecLoadResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Yüklenmiş tanım üzerinde çalışan komut.
 */
public interface SpecCommand {

    /**
     * @return Komut satırındaki adı
     */
    String name();

    String description();

    default boolean requiresOutput() {
        return true;
    }

    /**
     * @return Yazılan dosyalar
     */
    List<Path> execute(SpecLoadResult spec, CommandOptions options) throws IOException;
}
