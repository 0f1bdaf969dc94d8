package io.mersel.ucdoc.application.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Kullanım senaryosu.
 * <p>
 * Oluşturulduktan sonra değişmez. Akış geri bağlantıları {@link FlowLinks} dizininde tutulur.
 */
public record UseCase(String id, String name, String summary,
                      List<PreCondition> preConditions, List<PostCondition> postConditions,
                      List<Flow> basicFlows, List<AlternateFlow> alternateFlows, List<ExceptionFlow> exceptionFlows,
                      List<Variation> variations, FlowLinks links, List<Glossary> glossaries) {

    public UseCase {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
        summary = summary == null ? "" : summary;
        preConditions = List.copyOf(preConditions);
        postConditions = List.copyOf(postConditions);
        basicFlows = List.copyOf(basicFlows);
        alternateFlows = List.copyOf(alternateFlows);
        exceptionFlows = List.copyOf(exceptionFlows);
        variations = List.copyOf(variations);
        links = links == null ? FlowLinks.empty() : links;
        glossaries = List.copyOf(glossaries);
    }

    /**
     * @return Önce alternatif, sonra istisna akışları; tanım sırasıyla
     */
    public List<AltExFlow> getBranches() {
        List<AltExFlow> branches = new ArrayList<>(alternateFlows);
        branches.addAll(exceptionFlows);
        return branches;
    }

    public List<PreCondition> getAllPreConditions() {
        return preConditions.stream().flatMap(PreCondition::flatten).toList();
    }

    public List<PostCondition> getAllPostConditions() {
        return postConditions.stream().flatMap(PostCondition::flatten).toList();
    }

    /**
     * @return Temel ve dal akışlarındaki tüm adımlar, tanım sırasıyla
     */
    public List<Flow> getAllFlows() {
        List<Flow> flows = new ArrayList<>(basicFlows);
        for (AltExFlow branch : getBranches()) {
            flows.addAll(branch.nextFlows());
        }
        return flows;
    }

    /**
     * @return Adım tablosunda sütun olabilecek tüm id'ler (ön koşullar ve akışlar)
     */
    public Set<String> getEntryPointIds() {
        Set<String> ids = new LinkedHashSet<>();
        getAllPreConditions().forEach(p -> ids.add(p.id()));
        getAllFlows().forEach(f -> ids.add(f.id()));
        return ids;
    }

    /**
     * @return Akışlarda görünen taraflar, ilk geçiş sırasıyla
     */
    public List<Player> getPlayers() {
        Map<String, Player> players = new LinkedHashMap<>();
        for (Flow flow : getAllFlows()) {
            players.putIfAbsent(flow.player().kind() + ":" + flow.player().id(), flow.player());
        }
        return List.copyOf(players.values());
    }

    public Optional<Variation> findVariation(String variationId) {
        return variations.stream().filter(v -> v.id().equals(variationId)).findFirst();
    }

    public Optional<AltExFlow> findBranch(String branchId) {
        return getBranches().stream().filter(b -> b.id().equals(branchId)).findFirst();
    }
}
