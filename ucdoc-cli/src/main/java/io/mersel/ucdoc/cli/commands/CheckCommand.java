package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.models.SpecLoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Tanımı yükler ve doğrular; dosya yazmaz.
 */
@Component
public class CheckCommand implements SpecCommand {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Override
    public String name() {
        return "check";
    }

    @Override
    public String description() {
        return "Tanımı yükler ve kapsamı doğrular";
    }

    @Override
    public boolean requiresOutput() {
        return false;
    }

    @Override
    public List<Path> execute(SpecLoadResult spec, CommandOptions options) {
        log.info("Doğrulama tamamlandı: {} kullanım senaryosu, {} uyarı",
                spec.catalog().useCases().size(), spec.warnings().size());
        return List.of();
    }
}
