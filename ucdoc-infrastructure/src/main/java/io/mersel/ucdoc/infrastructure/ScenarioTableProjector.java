package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.interfaces.IScenarioTableProjector;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.DecisionTable.ConditionRow;
import io.mersel.ucdoc.application.models.EntryPoint;
import io.mersel.ucdoc.application.models.Flow;
import io.mersel.ucdoc.application.models.PreCondition;
import io.mersel.ucdoc.application.models.UcScenario;
import io.mersel.ucdoc.application.models.UcScenarioDecisionTable;
import io.mersel.ucdoc.application.models.UcScenarioStep;
import io.mersel.ucdoc.application.models.UseCase;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Karar tablosunu bir senaryonun adımlarına yansıtır.
 * <p>
 * Önce tüm ön koşullar, sonra senaryodaki her farklı akış için adım üretilir.
 * Koşul satırı bağlı olmayan giriş noktası tek bir yer tutucu adım alır.
 */
@Service
public class ScenarioTableProjector implements IScenarioTableProjector {

    private final ScenarioStepIdRegistry stepIdRegistry;

    public ScenarioTableProjector(ScenarioStepIdRegistry stepIdRegistry) {
        this.stepIdRegistry = stepIdRegistry;
    }

    @Override
    public UcScenarioDecisionTable project(UseCase useCase, UcScenario scenario, DecisionTable table) {
        Set<String> declaredIds = useCase.getEntryPointIds();
        List<UcScenarioStep> preConditionSteps = new ArrayList<>();
        for (PreCondition preCondition : useCase.getAllPreConditions()) {
            addSteps(preConditionSteps, preCondition, table, declaredIds);
        }
        List<UcScenarioStep> flowSteps = new ArrayList<>();
        for (Flow flow : scenario.distinctFlows()) {
            addSteps(flowSteps, flow, table, declaredIds);
        }
        return new UcScenarioDecisionTable(scenario, table, preConditionSteps, flowSteps);
    }

    private void addSteps(List<UcScenarioStep> steps, EntryPoint entryPoint, DecisionTable table,
                          Set<String> declaredIds) {
        List<ConditionRow> rows = table.getConditionRowsByEntryPoint(entryPoint.id());
        if (rows.isEmpty()) {
            steps.add(new UcScenarioStep(entryPoint.id(), entryPoint, null));
            return;
        }
        for (ConditionRow row : rows) {
            String stepId = stepIdRegistry.stepId(entryPoint.id(), row.factor().id(), row.level().text(),
                    declaredIds);
            steps.add(new UcScenarioStep(stepId, entryPoint, row));
        }
    }
}
