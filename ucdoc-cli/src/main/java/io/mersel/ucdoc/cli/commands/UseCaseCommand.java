package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.infrastructure.output.UseCaseMarkdownWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Her kullanım senaryosu için tanım dokümanını {@code <uc>.md} olarak yazar.
 */
@Component
public class UseCaseCommand implements SpecCommand {

    private final UseCaseMarkdownWriter writer;

    public UseCaseCommand(UseCaseMarkdownWriter writer) {
        this.writer = writer;
    }

    @Override
    public String name() {
        return "ucmd";
    }

    @Override
    public String description() {
        return "Kullanım senaryosu tanım dokümanlarını Markdown olarak yazar";
    }

    @Override
    public List<Path> execute(SpecLoadResult spec, CommandOptions options) throws IOException {
        List<Path> written = new ArrayList<>();
        for (UseCase useCase : spec.catalog().useCases()) {
            written.add(OutputFiles.write(options.outputDir(), useCase.id() + ".md",
                    writer.render(useCase, spec.catalog().scenarios())));
        }
        return written;
    }
}
