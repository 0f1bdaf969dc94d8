package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.infrastructure.output.CombinationMarkdownWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Her varyasyonun kombinasyon tablosunu {@code <uc>-<varyasyon>.pict.md} olarak yazar.
 */
@Component
public class PictCommand implements SpecCommand {

    private final CombinationMarkdownWriter writer;

    public PictCommand(CombinationMarkdownWriter writer) {
        this.writer = writer;
    }

    @Override
    public String name() {
        return "pict";
    }

    @Override
    public String description() {
        return "Kombinasyon tablolarını Markdown olarak yazar";
    }

    @Override
    public List<Path> execute(SpecLoadResult spec, CommandOptions options) throws IOException {
        List<Path> written = new ArrayList<>();
        for (UseCase useCase : spec.catalog().useCases()) {
            for (Variation variation : useCase.variations()) {
                written.add(OutputFiles.write(options.outputDir(),
                        useCase.id() + "-" + variation.id() + ".pict.md",
                        writer.render(useCase, variation)));
            }
        }
        return written;
    }
}
