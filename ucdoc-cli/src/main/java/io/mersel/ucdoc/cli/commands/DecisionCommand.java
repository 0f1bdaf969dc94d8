package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.interfaces.IBranchDecisionTableDeriver;
import io.mersel.ucdoc.application.models.AltExFlow;
import io.mersel.ucdoc.application.models.BranchDecisionTable;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.infrastructure.output.DecisionTableMarkdownWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Her varyasyonun karar tablosunu ve dal alt tablolarını {@code <uc>-<varyasyon>.decision.md} olarak yazar.
 */
@Component
public class DecisionCommand implements SpecCommand {

    private final DecisionTableMarkdownWriter writer;
    private final IBranchDecisionTableDeriver branchDeriver;

    public DecisionCommand(DecisionTableMarkdownWriter writer, IBranchDecisionTableDeriver branchDeriver) {
        this.writer = writer;
        this.branchDeriver = branchDeriver;
    }

    @Override
    public String name() {
        return "decision";
    }

    @Override
    public String description() {
        return "Karar tablolarını Markdown olarak yazar";
    }

    @Override
    public List<Path> execute(SpecLoadResult spec, CommandOptions options) throws IOException {
        List<Path> written = new ArrayList<>();
        for (UseCase useCase : spec.catalog().useCases()) {
            for (Variation variation : useCase.variations()) {
                DecisionTable table = spec.getTables(useCase.id()).get(variation.id());
                List<BranchDecisionTable> branchTables = new ArrayList<>();
                for (AltExFlow branch : useCase.getBranches()) {
                    branchDeriver.derive(variation, branch).ifPresent(branchTables::add);
                }
                written.add(OutputFiles.write(options.outputDir(),
                        useCase.id() + "-" + variation.id() + ".decision.md",
                        writer.render(useCase, variation, table, branchTables)));
            }
        }
        return written;
    }
}
