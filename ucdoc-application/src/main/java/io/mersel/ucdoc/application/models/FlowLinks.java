package io.mersel.ucdoc.application.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Akış geri bağlantı dizini.
 * <p>
 * Tüm akışlar oluşturulduktan sonra ayrı bir bağlama adımında kurulur:
 * her kaynak adım için oradan ayrılan dallar ve geri bağlantısı olan adımlar
 * (dal kaynağı veya alternatif akış dönüş hedefi).
 */
public final class FlowLinks {

    private final Map<String, List<AltExFlow>> branchesBySource;
    private final Set<String> backLinked;

    private FlowLinks(Map<String, List<AltExFlow>> branchesBySource, Set<String> backLinked) {
        this.branchesBySource = branchesBySource;
        this.backLinked = backLinked;
    }

    /**
     * Dallar tanım sırasıyla (önce alternatif, sonra istisna) verilmelidir.
     */
    public static FlowLinks link(List<? extends AltExFlow> branches) {
        Map<String, List<AltExFlow>> bySource = new LinkedHashMap<>();
        Set<String> backLinked = new LinkedHashSet<>();
        for (AltExFlow branch : branches) {
            for (Flow source : branch.sourceFlows()) {
                bySource.computeIfAbsent(source.id(), k -> new ArrayList<>()).add(branch);
                backLinked.add(source.id());
            }
            branch.resumeAt().ifPresent(target -> backLinked.add(target.id()));
        }
        bySource.replaceAll((k, v) -> List.copyOf(v));
        return new FlowLinks(Map.copyOf(bySource), Set.copyOf(backLinked));
    }

    public static FlowLinks empty() {
        return new FlowLinks(Map.of(), Set.of());
    }

    public List<AltExFlow> getBranchesFrom(String flowId) {
        return branchesBySource.getOrDefault(flowId, List.of());
    }

    public boolean hasBranches(String flowId) {
        return branchesBySource.containsKey(flowId);
    }

    public boolean hasBackLink(String flowId) {
        return backLinked.contains(flowId);
    }
}
