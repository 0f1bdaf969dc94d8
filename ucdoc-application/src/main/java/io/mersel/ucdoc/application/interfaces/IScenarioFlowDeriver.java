package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.models.UcScenarioSet;
import io.mersel.ucdoc.application.models.UseCase;

/**
 * Temel akış ve dallardan senaryo başına sıralı akış listesi türetir.
 */
public interface IScenarioFlowDeriver {

    UcScenarioSet derive(UseCase useCase);
}
