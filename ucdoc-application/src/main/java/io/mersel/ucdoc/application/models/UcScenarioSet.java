package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.BranchType;

import java.util.List;
import java.util.Optional;

/**
 * Bir kullanım senaryosunun tüm test senaryoları ve senaryo × akış matrisi satırları.
 *
 * @param useCaseId    Kullanım senaryosu
 * @param scenarios    Önce temel, sonra alternatif, sonra istisna senaryoları
 * @param orderedFlows Her temel adım ve hemen ardından o adımdan ayrılan dalların iç akışları
 * @param links        Akış geri bağlantı dizini
 */
public record UcScenarioSet(String useCaseId, List<UcScenario> scenarios, List<Flow> orderedFlows, FlowLinks links) {

    public UcScenarioSet {
        scenarios = List.copyOf(scenarios);
        orderedFlows = List.copyOf(orderedFlows);
    }

    public UcScenario getBasicScenario() {
        return scenarios.get(0);
    }

    public Optional<UcScenario> find(String scenarioId) {
        return scenarios.stream().filter(s -> s.id().equals(scenarioId)).findFirst();
    }

    /**
     * Akışı içeren ilk senaryoya göre dal sınıflandırması.
     *
     * @throws IllegalArgumentException Akış hiçbir senaryoda yoksa
     */
    public BranchType getBranchType(Flow flow) {
        UcScenario owner = scenarios.stream()
                .filter(s -> s.contains(flow.id()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Akış hiçbir senaryoda yok: " + flow.id()));
        return switch (owner.type()) {
            case BASIC -> links.hasBranches(flow.id()) ? BranchType.BRANCH : BranchType.NONE;
            case ALTERNATE -> BranchType.ALTERNATE;
            case EXCEPTION -> BranchType.EXCEPTION;
        };
    }
}
