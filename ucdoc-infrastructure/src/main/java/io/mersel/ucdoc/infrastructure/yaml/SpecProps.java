package io.mersel.ucdoc.infrastructure.yaml;

import java.util.List;
import java.util.Map;

/**
 * YAML tanımının tipli karşılığı.
 * <p>
 * Haritalar tanım sırasını korur. Anahtar kelime çözümlemesi bu ağaç üzerinde yapılır,
 * model kurulumu çözümlenmiş ağaçtan başlar.
 */
public final class SpecProps {

    private SpecProps() {
    }

    public record AppProps(Map<String, ActorProps> actors,
                           Map<String, Map<String, GlossaryProps>> glossaries,
                           Map<String, FactorProps> factors,
                           Map<String, UseCaseProps> usecases,
                           Map<String, ScenarioProps> scenarios) {
    }

    public record ActorProps(String name) {
    }

    public record GlossaryProps(String name, String desc, String url) {
    }

    public record FactorProps(String name, List<String> items) {
    }

    public record UseCaseProps(String name, String summary,
                               Map<String, ConditionProps> preConditions,
                               Map<String, ConditionProps> postConditions,
                               Map<String, FlowProps> basicFlows,
                               Map<String, BranchProps> alternateFlows,
                               Map<String, BranchProps> exceptionFlows,
                               Map<String, VariationProps> valiations) {
    }

    public record ConditionProps(String description, Map<String, ConditionProps> details) {
    }

    public record FlowProps(String playerId, String description) {
    }

    public record BranchProps(String description, Map<String, OverrideProps> override) {
    }

    public record OverrideProps(Map<String, FlowProps> replaceFlows, String returnFlowId) {
    }

    public record VariationProps(String description,
                                 Map<String, List<String>> factorEntryPoints,
                                 String pictConstraint,
                                 Map<String, ResultProps> results) {
    }

    public record ResultProps(String description, String order,
                              Map<String, List<String>> arrow,
                              Map<String, List<String>> disarrow,
                              List<String> verificationPointIds) {
    }

    public record ScenarioProps(String name, String summary, List<String> usecaseOrder) {
    }
}
