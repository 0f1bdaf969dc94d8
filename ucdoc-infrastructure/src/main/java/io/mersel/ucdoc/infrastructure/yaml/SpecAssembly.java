package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.application.models.Actor;
import io.mersel.ucdoc.application.models.BusinessScenario;
import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.FactorLevel;
import io.mersel.ucdoc.application.models.Glossary;
import io.mersel.ucdoc.application.models.GlossaryCatalog;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.UseCaseCatalog;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.AppProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ScenarioProps;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tipli tanım ağacından {@link UseCaseCatalog} kurar.
 * <p>
 * Önce aktörler, sözlük ve faktörler; ardından anahtar kelime çözümlemesi;
 * son olarak kullanım senaryoları ve iş senaryoları.
 */
@Component
public class SpecAssembly {

    private final UseCaseAssembler useCaseAssembler;

    public SpecAssembly(UseCaseAssembler useCaseAssembler) {
        this.useCaseAssembler = useCaseAssembler;
    }

    public UseCaseCatalog assemble(AppProps props, String replacementFormat) {
        ParserContext ctx = new ParserContext();

        Map<String, Actor> actors = new LinkedHashMap<>();
        props.actors().forEach((id, a) -> actors.put(id, new Actor(id, a.name())));

        List<Glossary> glossaryList = new ArrayList<>();
        props.glossaries().forEach((category, terms) -> terms.forEach((id, g) ->
                glossaryList.add(new Glossary(id, category, g.name(), g.desc(), g.url()))));
        GlossaryCatalog glossaries = new GlossaryCatalog(glossaryList);

        Map<String, Factor> factors = new LinkedHashMap<>();
        props.factors().forEach((id, f) ->
                factors.put(id, new Factor(id, f.name(), f.items().stream().map(FactorLevel::new).toList())));

        KeywordResolver.Resolution resolution =
                new KeywordResolver(glossaries, List.copyOf(actors.values()), replacementFormat).resolve(props);
        AppProps resolved = resolution.props();

        UseCaseAssembler.Catalog catalog = new UseCaseAssembler.Catalog(actors, glossaries, factors);
        Map<String, UseCase> useCases = new LinkedHashMap<>();
        ctx.push("usecases");
        for (var entry : resolved.usecases().entrySet()) {
            ctx.push(entry.getKey());
            useCases.put(entry.getKey(), useCaseAssembler.assemble(ctx, entry.getKey(), entry.getValue(), catalog,
                    resolution.glossariesByUseCase().getOrDefault(entry.getKey(), List.of())));
            ctx.pop();
        }
        ctx.pop();

        List<BusinessScenario> scenarios = new ArrayList<>();
        ctx.push("scenarios");
        for (var entry : resolved.scenarios().entrySet()) {
            ctx.push(entry.getKey());
            scenarios.add(scenario(ctx, entry.getKey(), entry.getValue(), useCases));
            ctx.pop();
        }
        ctx.pop();

        return new UseCaseCatalog(List.copyOf(actors.values()), glossaries, List.copyOf(factors.values()),
                List.copyOf(useCases.values()), scenarios);
    }

    private BusinessScenario scenario(ParserContext ctx, String id, ScenarioProps props, Map<String, UseCase> useCases) {
        List<UseCase> order = new ArrayList<>();
        ctx.push("usecaseOrder");
        for (String useCaseId : props.usecaseOrder()) {
            UseCase useCase = useCases.get(useCaseId);
            if (useCase == null) {
                throw ctx.structural("usecases içinde tanımlı değil: " + useCaseId);
            }
            order.add(useCase);
        }
        ctx.pop();
        return new BusinessScenario(id, props.name(), props.summary(), order);
    }
}
