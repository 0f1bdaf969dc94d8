package io.mersel.ucdoc.infrastructure.output;

import io.mersel.ucdoc.application.models.Actor;
import io.mersel.ucdoc.application.models.AltExFlow;
import io.mersel.ucdoc.application.models.AlternateFlow;
import io.mersel.ucdoc.application.models.BusinessScenario;
import io.mersel.ucdoc.application.models.ExceptionFlow;
import io.mersel.ucdoc.application.models.Flow;
import io.mersel.ucdoc.application.models.Glossary;
import io.mersel.ucdoc.application.models.GlossaryCatalog;
import io.mersel.ucdoc.application.models.Player;
import io.mersel.ucdoc.application.models.PostCondition;
import io.mersel.ucdoc.application.models.PreCondition;
import io.mersel.ucdoc.application.models.UseCase;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kullanım senaryosu tanım dokümanını Markdown olarak yazar.
 * <p>
 * Doküman YAML ön bilgisi (id, ad) ile başlar; özet, ön/son koşullar, aktörler,
 * temel/alternatif/istisna akışları, ilgili sözlük terimleri ve senaryonun geçtiği
 * iş senaryoları bölümlerinden oluşur.
 * <p>
 * Geri bağlantısı olan temel adımlar ve dallar çapa alır; bunlara yapılan
 * {@code [id][]} referanslarının hedefleri dokümanın sonunda tanımlanır.
 */
@Component
public class UseCaseMarkdownWriter {

    private final Yaml frontMatterYaml;

    public UseCaseMarkdownWriter() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setAllowUnicode(true);
        this.frontMatterYaml = new Yaml(options);
    }

    /**
     * @param scenarios Katalogdaki tüm iş senaryoları; yalnızca bu kullanım senaryosunu içerenler yazılır
     */
    public String render(UseCase useCase, List<BusinessScenario> scenarios) {
        Set<String> linkTargets = new LinkedHashSet<>();
        StringBuilder sb = new StringBuilder();

        Map<String, Object> frontMatter = new LinkedHashMap<>();
        frontMatter.put("id", useCase.id());
        frontMatter.put("name", useCase.name());
        sb.append("---\n").append(frontMatterYaml.dump(frontMatter).stripTrailing()).append("\n---\n\n");

        sb.append("# ").append(useCase.id()).append(' ').append(inline(useCase.name())).append("\n\n");
        sb.append("## Özet\n\n").append(useCase.summary().strip()).append("\n\n");

        sb.append("## Ön koşullar\n\n");
        useCase.preConditions().forEach(p -> appendPreCondition(sb, p, 0));
        sb.append('\n');

        sb.append("## Son koşullar\n\n");
        useCase.postConditions().forEach(p -> appendPostCondition(sb, p, 0));
        sb.append('\n');

        sb.append("## Aktörler\n\n");
        for (Player player : useCase.getPlayers()) {
            if (player instanceof Actor actor) {
                sb.append("- ").append(anchor(actor.id())).append(": ").append(inline(actor.name())).append('\n');
            }
        }
        sb.append('\n');

        sb.append("## Temel akış\n\n");
        for (Flow flow : useCase.basicFlows()) {
            boolean backLinked = useCase.links().hasBackLink(flow.id());
            sb.append("- ").append(backLinked ? anchor(flow.id()) : flow.id()).append(": ").append(step(flow));
            List<AltExFlow> branches = useCase.links().getBranchesFrom(flow.id());
            if (!branches.isEmpty()) {
                sb.append(" (").append(branches.stream()
                        .map(b -> reference(b.id(), linkTargets))
                        .collect(Collectors.joining(", "))).append(')');
            }
            sb.append('\n');
        }
        sb.append('\n');

        sb.append("## Alternatif akışlar\n\n");
        for (AlternateFlow flow : useCase.alternateFlows()) {
            appendBranch(sb, flow, linkTargets);
            sb.append("    - ").append(reference(flow.returnFlow().id(), linkTargets)).append(" adımına dönülür\n");
        }
        sb.append('\n');

        sb.append("## İstisna akışları\n\n");
        for (ExceptionFlow flow : useCase.exceptionFlows()) {
            appendBranch(sb, flow, linkTargets);
            sb.append("    - Bitiş\n");
        }

        if (!useCase.glossaries().isEmpty()) {
            sb.append("\n## İlgili terimler\n\n");
            GlossaryCatalog related = new GlossaryCatalog(useCase.glossaries());
            for (String category : related.getCategories()) {
                sb.append("- ").append(inline(category)).append('\n');
                for (Glossary glossary : related.getByCategory(category)) {
                    String text = glossary.url() == null
                            ? inline(glossary.text())
                            : "[" + inline(glossary.text()) + "](" + glossary.url() + ")";
                    sb.append("    - ").append(anchor(glossary.id())).append(": ").append(text).append('\n');
                }
            }
        }

        List<BusinessScenario> including = scenarios.stream()
                .filter(s -> s.useCaseOrder().stream().anyMatch(u -> u.id().equals(useCase.id())))
                .toList();
        if (!including.isEmpty()) {
            sb.append("\n## İş senaryoları\n\n");
            for (BusinessScenario scenario : including) {
                sb.append("- ").append(scenario.id()).append(' ').append(inline(scenario.name())).append(": ")
                        .append(scenario.useCaseOrder().stream()
                                .map(u -> u.id().equals(useCase.id()) ? "**" + u.id() + "**" : u.id())
                                .collect(Collectors.joining(" → ")))
                        .append('\n');
            }
        }

        if (!linkTargets.isEmpty()) {
            sb.append('\n');
            linkTargets.forEach(id -> sb.append('[').append(id).append("]: #").append(id).append('\n'));
        }
        return sb.toString();
    }

    private void appendPreCondition(StringBuilder sb, PreCondition condition, int depth) {
        sb.append("    ".repeat(depth)).append("- ").append(condition.id()).append(": ")
                .append(inline(condition.description())).append('\n');
        condition.details().forEach(d -> appendPreCondition(sb, d, depth + 1));
    }

    private void appendPostCondition(StringBuilder sb, PostCondition condition, int depth) {
        sb.append("    ".repeat(depth)).append("- ").append(condition.id()).append(": ")
                .append(inline(condition.description())).append('\n');
        condition.details().forEach(d -> appendPostCondition(sb, d, depth + 1));
    }

    private void appendBranch(StringBuilder sb, AltExFlow branch, Set<String> linkTargets) {
        sb.append("- ").append(anchor(branch.id())).append(": ").append(inline(branch.description()))
                .append(" (Kaynak: ").append(branch.sourceFlows().stream()
                        .map(f -> reference(f.id(), linkTargets))
                        .collect(Collectors.joining(", "))).append(")\n");
        for (Flow next : branch.nextFlows()) {
            sb.append("    - ").append(next.id()).append(": ").append(step(next)).append('\n');
        }
    }

    private String step(Flow flow) {
        Player player = flow.player();
        return "[" + inline(player.text()) + "](#" + player.id() + ") " + inline(flow.description());
    }

    private static String reference(String id, Set<String> linkTargets) {
        linkTargets.add(id);
        return "[" + id + "][]";
    }

    private static String anchor(String id) {
        return "<a name=\"" + id + "\">" + id + "</a>";
    }

    private static String inline(String text) {
        if (text == null) {
            return "";
        }
        return text.strip().replace("\r\n", " ").replace("\n", " ");
    }
}
