package io.mersel.ucdoc.application.models;

import java.util.Objects;
import java.util.Optional;

/**
 * Senaryo karar tablosunda tek bir adım.
 *
 * @param stepId     Kararlı adım id'si
 * @param entryPoint Ön koşul veya akış
 * @param row        Bağlı koşul satırı; yer tutucu adımda null
 */
public record UcScenarioStep(String stepId, EntryPoint entryPoint, DecisionTable.ConditionRow row) {

    public UcScenarioStep {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(entryPoint, "entryPoint");
    }

    public Optional<DecisionTable.ConditionRow> getRow() {
        return Optional.ofNullable(row);
    }

    public boolean isPlaceholder() {
        return row == null;
    }
}
