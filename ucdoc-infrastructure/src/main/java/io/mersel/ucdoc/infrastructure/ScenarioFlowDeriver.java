package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.interfaces.IScenarioFlowDeriver;
import io.mersel.ucdoc.application.models.AltExFlow;
import io.mersel.ucdoc.application.models.Flow;
import io.mersel.ucdoc.application.models.UcScenario;
import io.mersel.ucdoc.application.models.UcScenarioSet;
import io.mersel.ucdoc.application.models.UseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Senaryo akış türetici.
 * <p>
 * {@code TP01} temel akıştır. Ardından her alternatif akış, sonra her istisna akışı
 * için bir senaryo türetilir: temel akışta ilk kaynak adıma kadar olan adımlar
 * kopyalanır, kaynak adımın yerine dalın iç akışları yazılır. Alternatif akış
 * dönüş adımının temel akıştaki konumundan sona kadar devam eder (geriye dönüşte
 * o adımlar bir kez daha çalışır); istisna akışı orada biter.
 */
@Service
public class ScenarioFlowDeriver implements IScenarioFlowDeriver {

    private static final Logger log = LoggerFactory.getLogger(ScenarioFlowDeriver.class);

    static final String BASIC_DESCRIPTION = "Temel akış sorunsuz çalışır ve son koşullar sağlanır";
    static final String ALTERNATE_DESCRIPTION = "Alternatif akış %s: %s";
    static final String EXCEPTION_DESCRIPTION = "İstisna akışı %s: %s";

    @Override
    public UcScenarioSet derive(UseCase useCase) {
        List<UcScenario> scenarios = new ArrayList<>();
        scenarios.add(new UcScenario(scenarioId(1), BASIC_DESCRIPTION, useCase.basicFlows(), null));

        for (AltExFlow branch : useCase.getBranches()) {
            String template = switch (branch.branchKind()) {
                case ALTERNATE -> ALTERNATE_DESCRIPTION;
                case EXCEPTION -> EXCEPTION_DESCRIPTION;
            };
            scenarios.add(new UcScenario(scenarioId(scenarios.size() + 1),
                    String.format(template, branch.id(), branch.description()),
                    deriveFlows(useCase.basicFlows(), branch), branch));
        }

        log.debug("  {} için {} senaryo türetildi", useCase.id(), scenarios.size());
        return new UcScenarioSet(useCase.id(), scenarios, orderedFlows(useCase), useCase.links());
    }

    /**
     * Tek bir dal için akış dizisini türetir.
     */
    List<Flow> deriveFlows(List<Flow> basicFlows, AltExFlow branch) {
        List<Flow> flows = new ArrayList<>();
        for (Flow flow : basicFlows) {
            if (!branch.startsAt(flow.id())) {
                flows.add(flow);
                continue;
            }
            flows.addAll(branch.nextFlows());
            branch.resumeAt().ifPresent(target -> {
                int index = indexOf(basicFlows, target.id());
                if (index >= 0) {
                    flows.addAll(basicFlows.subList(index, basicFlows.size()));
                }
            });
            return flows;
        }
        return flows;
    }

    /**
     * Senaryo × akış matrisinin satırları: her temel adım, ardından o adımdan
     * ayrılan dalların iç akışları. Birden fazla kaynağı olan dal yalnızca ilk kaynağın altında yer alır.
     */
    private List<Flow> orderedFlows(UseCase useCase) {
        List<Flow> ordered = new ArrayList<>();
        Set<String> emittedBranches = new HashSet<>();
        for (Flow flow : useCase.basicFlows()) {
            ordered.add(flow);
            for (AltExFlow branch : useCase.links().getBranchesFrom(flow.id())) {
                if (emittedBranches.add(branch.id())) {
                    ordered.addAll(branch.nextFlows());
                }
            }
        }
        return ordered;
    }

    private static int indexOf(List<Flow> flows, String flowId) {
        for (int i = 0; i < flows.size(); i++) {
            if (flows.get(i).id().equals(flowId)) {
                return i;
            }
        }
        return -1;
    }

    static String scenarioId(int sequence) {
        return String.format("TP%02d", sequence);
    }
}
