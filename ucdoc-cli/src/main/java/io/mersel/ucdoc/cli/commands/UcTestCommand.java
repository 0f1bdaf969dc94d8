package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.interfaces.IScenarioFlowDeriver;
import io.mersel.ucdoc.application.interfaces.IScenarioTableProjector;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.application.models.UcScenario;
import io.mersel.ucdoc.application.models.UcScenarioDecisionTable;
import io.mersel.ucdoc.application.models.UcScenarioSet;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.infrastructure.output.UseCaseTestDocumentWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Her kullanım senaryosu için senaryo test dokümanını {@code <uc>.uctest.json} olarak yazar.
 */
@Component
public class UcTestCommand implements SpecCommand {

    private final IScenarioFlowDeriver flowDeriver;
    private final IScenarioTableProjector projector;
    private final UseCaseTestDocumentWriter writer;

    public UcTestCommand(IScenarioFlowDeriver flowDeriver, IScenarioTableProjector projector,
                         UseCaseTestDocumentWriter writer) {
        this.flowDeriver = flowDeriver;
        this.projector = projector;
        this.writer = writer;
    }

    @Override
    public String name() {
        return "uctest";
    }

    @Override
    public String description() {
        return "Senaryo test dokümanlarını JSON olarak yazar";
    }

    @Override
    public List<Path> execute(SpecLoadResult spec, CommandOptions options) throws IOException {
        List<Path> written = new ArrayList<>();
        for (UseCase useCase : spec.catalog().useCases()) {
            UcScenarioSet scenarioSet = flowDeriver.derive(useCase);
            List<UcScenarioDecisionTable> stepTables = new ArrayList<>();
            for (UcScenario scenario : scenarioSet.scenarios()) {
                for (Variation variation : useCase.variations()) {
                    DecisionTable table = spec.getTables(useCase.id()).get(variation.id());
                    stepTables.add(projector.project(useCase, scenario, table));
                }
            }
            written.add(OutputFiles.write(options.outputDir(), useCase.id() + ".uctest.json",
                    writer.render(useCase, scenarioSet, stepTables)));
        }
        return written;
    }
}
