package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.ScenarioType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tek bir test senaryosu: sıralı akış listesi ve (temel senaryo dışında) hedef dal.
 *
 * @param id          Senaryo id'si ({@code TP01}, {@code TP02}, ...)
 * @param description Açıklama
 * @param flows       Çalışma sırasıyla akışlar
 * @param branch      Hedef dal; temel senaryoda null
 */
public record UcScenario(String id, String description, List<Flow> flows, AltExFlow branch) {

    public UcScenario {
        Objects.requireNonNull(id, "id");
        description = description == null ? "" : description;
        flows = List.copyOf(flows);
    }

    public ScenarioType type() {
        if (branch == null) {
            return ScenarioType.BASIC;
        }
        return switch (branch.branchKind()) {
            case ALTERNATE -> ScenarioType.ALTERNATE;
            case EXCEPTION -> ScenarioType.EXCEPTION;
        };
    }

    public Optional<AltExFlow> getBranch() {
        return Optional.ofNullable(branch);
    }

    public boolean contains(String flowId) {
        return flows.stream().anyMatch(f -> f.id().equals(flowId));
    }

    /**
     * @return Tekrarlar çıkarılmış akışlar, ilk geçiş sırasıyla
     */
    public List<Flow> distinctFlows() {
        return flows.stream().distinct().toList();
    }
}
