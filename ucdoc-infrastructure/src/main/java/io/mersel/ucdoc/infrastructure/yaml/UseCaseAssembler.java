package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.application.enums.BranchKind;
import io.mersel.ucdoc.application.models.Actor;
import io.mersel.ucdoc.application.models.AltExFlow;
import io.mersel.ucdoc.application.models.AlternateFlow;
import io.mersel.ucdoc.application.models.EntryPoint;
import io.mersel.ucdoc.application.models.ExceptionFlow;
import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.Flow;
import io.mersel.ucdoc.application.models.FlowLinks;
import io.mersel.ucdoc.application.models.Glossary;
import io.mersel.ucdoc.application.models.GlossaryCatalog;
import io.mersel.ucdoc.application.models.Player;
import io.mersel.ucdoc.application.models.PostCondition;
import io.mersel.ucdoc.application.models.PreCondition;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VerificationPoint;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.BranchProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ConditionProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.FlowProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.OverrideProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.UseCaseProps;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kullanım senaryosu kurucu.
 * <p>
 * Sırası: koşul ağaçları, temel akışlar, dallar, bağlama adımı ({@link FlowLinks}),
 * varyasyonlar. Tüm id'ler aynı {@link IdRegistry} kaydına yazılır; tekrar eden id
 * karar tablosu kurulmadan önce yüklemeyi durdurur.
 */
@Component
public class UseCaseAssembler {

    private final VariationAssembler variationAssembler;

    public UseCaseAssembler(VariationAssembler variationAssembler) {
        this.variationAssembler = variationAssembler;
    }

    /**
     * Kurulum için gereken üst düzey tanımlar.
     */
    public record Catalog(Map<String, Actor> actors, GlossaryCatalog glossaries, Map<String, Factor> factors) {
    }

    UseCase assemble(ParserContext ctx, String id, UseCaseProps props, Catalog catalog, List<Glossary> usedGlossaries) {
        IdRegistry ids = new IdRegistry();
        Set<Glossary> glossaries = new LinkedHashSet<>(usedGlossaries);

        List<PreCondition> preConditions = new ArrayList<>();
        ctx.push("preConditions");
        props.preConditions().forEach((pid, p) -> preConditions.add(preCondition(ctx, pid, p, ids)));
        ctx.pop();

        List<PostCondition> postConditions = new ArrayList<>();
        ctx.push("postConditions");
        props.postConditions().forEach((pid, p) -> postConditions.add(postCondition(ctx, pid, p, ids)));
        ctx.pop();

        Map<String, Flow> basicFlows = new LinkedHashMap<>();
        ctx.push("basicFlows");
        props.basicFlows().forEach((fid, f) -> basicFlows.put(fid, flow(ctx, fid, f, ids, catalog, glossaries)));
        ctx.pop();

        List<AlternateFlow> alternateFlows = new ArrayList<>();
        ctx.push("alternateFlows");
        props.alternateFlows().forEach((bid, b) -> alternateFlows.add(
                (AlternateFlow) branch(ctx, BranchKind.ALTERNATE, bid, b, basicFlows, ids, catalog, glossaries)));
        ctx.pop();

        List<ExceptionFlow> exceptionFlows = new ArrayList<>();
        ctx.push("exceptionFlows");
        props.exceptionFlows().forEach((bid, b) -> exceptionFlows.add(
                (ExceptionFlow) branch(ctx, BranchKind.EXCEPTION, bid, b, basicFlows, ids, catalog, glossaries)));
        ctx.pop();

        List<AltExFlow> branches = new ArrayList<>(alternateFlows);
        branches.addAll(exceptionFlows);
        FlowLinks links = FlowLinks.link(branches);

        Map<String, EntryPoint> entryPoints = new LinkedHashMap<>();
        preConditions.stream().flatMap(PreCondition::flatten).forEach(p -> entryPoints.put(p.id(), p));
        entryPoints.putAll(basicFlows);

        Map<String, VerificationPoint> verificationPoints = new LinkedHashMap<>();
        postConditions.stream().flatMap(PostCondition::flatten).forEach(p -> verificationPoints.put(p.id(), p));
        branches.forEach(b -> verificationPoints.put(b.id(), b));

        List<Variation> variations = new ArrayList<>();
        ctx.push("valiations");
        for (var entry : props.valiations().entrySet()) {
            ctx.push(entry.getKey());
            ids.register(ctx, entry.getKey());
            variations.add(variationAssembler.assemble(ctx, entry.getKey(), entry.getValue(), entryPoints,
                    catalog.factors(), verificationPoints, ids));
            ctx.pop();
        }
        ctx.pop();

        return new UseCase(id, props.name(), props.summary(), preConditions, postConditions,
                List.copyOf(basicFlows.values()), alternateFlows, exceptionFlows, variations, links,
                List.copyOf(glossaries));
    }

    private PreCondition preCondition(ParserContext ctx, String id, ConditionProps props, IdRegistry ids) {
        ctx.push(id);
        ids.register(ctx, id);
        List<PreCondition> details = new ArrayList<>();
        ctx.push("details");
        props.details().forEach((did, d) -> details.add(preCondition(ctx, did, d, ids)));
        ctx.pop();
        ctx.pop();
        return new PreCondition(id, props.description(), details);
    }

    private PostCondition postCondition(ParserContext ctx, String id, ConditionProps props, IdRegistry ids) {
        ctx.push(id);
        ids.register(ctx, id);
        List<PostCondition> details = new ArrayList<>();
        ctx.push("details");
        props.details().forEach((did, d) -> details.add(postCondition(ctx, did, d, ids)));
        ctx.pop();
        ctx.pop();
        return new PostCondition(id, props.description(), details);
    }

    private Flow flow(ParserContext ctx, String id, FlowProps props, IdRegistry ids, Catalog catalog,
                      Set<Glossary> glossaries) {
        ctx.push(id);
        ids.register(ctx, id);
        ctx.push("playerId");
        Player player = player(ctx, props.playerId(), catalog);
        if (player instanceof Glossary glossary) {
            glossaries.add(glossary);
        }
        ctx.pop();
        ctx.pop();
        return new Flow(id, props.description(), player);
    }

    private Player player(ParserContext ctx, String playerId, Catalog catalog) {
        Actor actor = catalog.actors().get(playerId);
        if (actor != null) {
            return actor;
        }
        return catalog.glossaries().find(playerId, null)
                .orElseThrow(() -> ctx.structural("actors veya glossaries içinde tanımlı değil: " + playerId));
    }

    /**
     * Her override girdisi bir kaynak akış ekler; iç akışlar girdilerin sırasıyla birleştirilir.
     * Alternatif akışta tüm girdiler aynı dönüş adımını göstermelidir.
     */
    private AltExFlow branch(ParserContext ctx, BranchKind kind, String id, BranchProps props,
                             Map<String, Flow> basicFlows, IdRegistry ids, Catalog catalog, Set<Glossary> glossaries) {
        ctx.push(id);
        ids.register(ctx, id);

        List<Flow> sources = new ArrayList<>();
        List<Flow> nested = new ArrayList<>();
        Flow returnFlow = null;

        ctx.push("override");
        for (var entry : props.override().entrySet()) {
            ctx.push(entry.getKey());
            Flow source = basicFlows.get(entry.getKey());
            if (source == null) {
                throw ctx.structural("basicFlows içinde tanımlı değil: " + entry.getKey());
            }
            sources.add(source);

            OverrideProps override = entry.getValue();
            ctx.push("replaceFlows");
            override.replaceFlows().forEach((fid, f) -> nested.add(flow(ctx, fid, f, ids, catalog, glossaries)));
            ctx.pop();

            ctx.push("returnFlowId");
            String returnFlowId = override.returnFlowId();
            if (kind == BranchKind.EXCEPTION && returnFlowId != null) {
                throw ctx.structural("istisna akışında returnFlowId tanımlanamaz");
            }
            if (kind == BranchKind.ALTERNATE) {
                if (returnFlowId == null || returnFlowId.isBlank()) {
                    throw ctx.structural("returnFlowId tanımı zorunlu");
                }
                Flow target = basicFlows.get(returnFlowId);
                if (target == null) {
                    throw ctx.structural("basicFlows içinde tanımlı değil: " + returnFlowId);
                }
                if (returnFlow != null && !returnFlow.id().equals(target.id())) {
                    throw ctx.structural("aynı alternatif akışta farklı dönüş adımları: "
                            + returnFlow.id() + ", " + target.id());
                }
                returnFlow = target;
            }
            ctx.pop();
            ctx.pop();
        }
        ctx.pop();
        ctx.pop();

        return switch (kind) {
            case ALTERNATE -> new AlternateFlow(id, props.description(), sources, nested, returnFlow);
            case EXCEPTION -> new ExceptionFlow(id, props.description(), sources, nested);
        };
    }
}
