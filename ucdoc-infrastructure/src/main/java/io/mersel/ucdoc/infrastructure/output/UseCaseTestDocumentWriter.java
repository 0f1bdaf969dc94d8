package io.mersel.ucdoc.infrastructure.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.mersel.ucdoc.application.enums.ConditionMark;
import io.mersel.ucdoc.application.enums.ResultMark;
import io.mersel.ucdoc.application.models.Flow;
import io.mersel.ucdoc.application.models.PostCondition;
import io.mersel.ucdoc.application.models.PreCondition;
import io.mersel.ucdoc.application.models.UcScenario;
import io.mersel.ucdoc.application.models.UcScenarioDecisionTable;
import io.mersel.ucdoc.application.models.UcScenarioSet;
import io.mersel.ucdoc.application.models.UcScenarioStep;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.VerificationPoint;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Kullanım senaryosu test dokümanını JSON olarak yazar.
 * <p>
 * İçerik: senaryo özeti, taraflar, ön/son koşullar, senaryo × akış matrisi ve
 * her (senaryo, varyasyon) için adım tablosu.
 */
@Component
public class UseCaseTestDocumentWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public record Document(String useCaseId, String name, String summary, List<ScenarioSummary> scenarios,
                    List<PlayerEntry> players, List<ConditionEntry> preConditions,
                    List<ConditionEntry> postConditions, List<FlowRow> flowMatrix, List<StepTable> stepTables) {
    }

    public record ScenarioSummary(String id, String type, String branchId, String description) {
    }

    public record PlayerEntry(String id, String kind, String text) {
    }

    public record ConditionEntry(String id, String description, List<ConditionEntry> details) {
    }

    public record FlowRow(String flowId, String player, String description, String branchType, List<Boolean> scenarios) {
    }

    public record StepTable(String scenarioId, String variationId, int ruleCount, List<Step> steps, List<ResultLine> results) {
    }

    public record Step(String stepId, String entryPointId, String factor, String level, List<String> marks) {
    }

    public record ResultLine(String resultId, String description, List<String> verificationPointIds, List<String> marks) {
    }

    public String render(UseCase useCase, UcScenarioSet scenarioSet, List<UcScenarioDecisionTable> stepTables) {
        Document document = new Document(
                useCase.id(),
                useCase.name(),
                useCase.summary(),
                scenarioSet.scenarios().stream().map(this::summary).toList(),
                useCase.getPlayers().stream().map(p -> new PlayerEntry(p.id(), p.kind().name(), p.text())).toList(),
                useCase.preConditions().stream().map(this::preCondition).toList(),
                useCase.postConditions().stream().map(this::postCondition).toList(),
                scenarioSet.orderedFlows().stream().map(f -> flowRow(f, scenarioSet)).toList(),
                stepTables.stream().map(this::stepTable).toList());
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Test dokümanı serileştirilemedi: " + useCase.id(), e);
        }
    }

    private ScenarioSummary summary(UcScenario scenario) {
        return new ScenarioSummary(scenario.id(), scenario.type().getDisplayName(),
                scenario.getBranch().map(VerificationPoint::id).orElse(null), scenario.description());
    }

    private ConditionEntry preCondition(PreCondition condition) {
        return new ConditionEntry(condition.id(), condition.description(),
                condition.details().stream().map(this::preCondition).toList());
    }

    private ConditionEntry postCondition(PostCondition condition) {
        return new ConditionEntry(condition.id(), condition.description(),
                condition.details().stream().map(this::postCondition).toList());
    }

    private FlowRow flowRow(Flow flow, UcScenarioSet scenarioSet) {
        return new FlowRow(flow.id(), flow.player().text(), flow.description(),
                scenarioSet.getBranchType(flow).name(),
                scenarioSet.scenarios().stream().map(s -> s.contains(flow.id())).toList());
    }

    private StepTable stepTable(UcScenarioDecisionTable table) {
        List<Step> steps = table.getAllSteps().stream().map(this::step).toList();
        List<ResultLine> results = table.table().resultRows().stream()
                .map(r -> new ResultLine(r.result().id(), r.result().description(),
                        r.result().verificationPoints().stream().map(VerificationPoint::id).toList(),
                        r.marks().stream().map(ResultMark::getSymbol).toList()))
                .toList();
        return new StepTable(table.scenario().id(), table.table().variationId(), table.table().ruleCount(),
                steps, results);
    }

    private Step step(UcScenarioStep step) {
        return step.getRow()
                .map(row -> new Step(step.stepId(), step.entryPoint().id(), row.factor().name(), row.level().text(),
                        row.marks().stream().map(ConditionMark::getSymbol).toList()))
                .orElseGet(() -> new Step(step.stepId(), step.entryPoint().id(), null, null, List.of()));
    }
}
