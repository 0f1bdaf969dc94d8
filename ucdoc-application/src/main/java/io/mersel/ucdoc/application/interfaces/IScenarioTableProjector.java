package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.UcScenario;
import io.mersel.ucdoc.application.models.UcScenarioDecisionTable;
import io.mersel.ucdoc.application.models.UseCase;

/**
 * Karar tablosunu tek bir senaryonun adım dizisine yansıtır.
 */
public interface IScenarioTableProjector {

    UcScenarioDecisionTable project(UseCase useCase, UcScenario scenario, DecisionTable table);
}
