package io.mersel.ucdoc.application.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Bir (senaryo, varyasyon) çifti için adım tablosu: önce ön koşul adımları, sonra akış adımları.
 */
public record UcScenarioDecisionTable(UcScenario scenario, DecisionTable table,
                                      List<UcScenarioStep> preConditionSteps, List<UcScenarioStep> flowSteps) {

    public UcScenarioDecisionTable {
        preConditionSteps = List.copyOf(preConditionSteps);
        flowSteps = List.copyOf(flowSteps);
    }

    public List<UcScenarioStep> getAllSteps() {
        List<UcScenarioStep> steps = new ArrayList<>(preConditionSteps);
        steps.addAll(flowSteps);
        return steps;
    }
}
