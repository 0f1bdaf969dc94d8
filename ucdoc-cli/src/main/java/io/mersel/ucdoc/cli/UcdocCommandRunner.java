package io.mersel.ucdoc.cli;

import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.interfaces.IUseCaseSpecLoader;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.cli.commands.CommandOptions;
import io.mersel.ucdoc.cli.commands.SpecCommand;
import io.mersel.ucdoc.cli.infrastructure.CommandFailureHandler;
import io.mersel.ucdoc.infrastructure.config.UcdocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Komut satırı çalıştırıcı.
 * <p>
 * Kullanım: {@code ucdoc <komut> <dosya> [dosya...] --output=<dizin> [--strict | --lenient]}
 * <p>
 * Tanımı yükler, komutu çalıştırır ve sonucu çıkış koduna yansıtır.
 */
@Component
public class UcdocCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(UcdocCommandRunner.class);

    private final IUseCaseSpecLoader loader;
    private final Map<String, SpecCommand> commands = new LinkedHashMap<>();
    private final CommandFailureHandler failureHandler;
    private final UcdocProperties properties;

    private int exitCode = 0;

    public UcdocCommandRunner(IUseCaseSpecLoader loader, List<SpecCommand> commands,
                              CommandFailureHandler failureHandler, UcdocProperties properties) {
        this.loader = loader;
        commands.forEach(c -> this.commands.put(c.name(), c));
        this.failureHandler = failureHandler;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            CommandOptions options = parse(args);
            SpecCommand command = commands.get(options.command());
            SpecLoadResult spec = loader.load(options.files(), options.mode());
            List<Path> written = command.execute(spec, options);
            log.info("{} tamamlandı: {} dosya yazıldı", command.name(), written.size());
            exitCode = 0;
        } catch (Exception e) {
            exitCode = failureHandler.handle(e);
        }
    }

    CommandOptions parse(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            throw new IllegalArgumentException(usage());
        }
        String name = positional.get(0);
        SpecCommand command = commands.get(name);
        if (command == null) {
            throw new IllegalArgumentException("Bilinmeyen komut: " + name + "\n" + usage());
        }
        if (positional.size() < 2) {
            throw new IllegalArgumentException("En az bir tanım dosyası verilmeli\n" + usage());
        }
        List<Path> files = positional.subList(1, positional.size()).stream().map(Path::of).toList();

        Path outputDir = null;
        List<String> output = args.getOptionValues("output");
        if (output != null && !output.isEmpty()) {
            outputDir = Path.of(output.get(output.size() - 1));
        } else if (command.requiresOutput()) {
            throw new IllegalArgumentException("--output=<dizin> seçeneği zorunlu\n" + usage());
        }

        if (args.containsOption("strict") && args.containsOption("lenient")) {
            throw new IllegalArgumentException("--strict ve --lenient birlikte kullanılamaz");
        }
        ValidationMode mode = properties.getValidation().isStrict() ? ValidationMode.STRICT : ValidationMode.LENIENT;
        if (args.containsOption("strict")) {
            mode = ValidationMode.STRICT;
        } else if (args.containsOption("lenient")) {
            mode = ValidationMode.LENIENT;
        }
        return new CommandOptions(name, files, outputDir, mode);
    }

    private String usage() {
        StringBuilder sb = new StringBuilder("Kullanım: ucdoc <komut> <dosya> [dosya...] --output=<dizin> [--strict | --lenient]\nKomutlar:");
        commands.values().forEach(c -> sb.append("\n  ").append(c.name()).append(" - ").append(c.description()));
        return sb.toString();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
