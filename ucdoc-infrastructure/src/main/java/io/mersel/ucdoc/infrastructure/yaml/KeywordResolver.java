package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.application.models.Actor;
import io.mersel.ucdoc.application.models.Glossary;
import io.mersel.ucdoc.application.models.GlossaryCatalog;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.AppProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.BranchProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ConditionProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.FlowProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.OverrideProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ResultProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ScenarioProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.UseCaseProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.VariationProps;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code ${kategori/terim}} ve {@code ${terim}} anahtar kelimelerini çözümler.
 * <p>
 * Tipli tanım ağacını açıkça gezer ve yalnızca metin alanlarını (ad, özet, açıklamalar)
 * yeniden yazar; id ve referans alanlarına dokunmaz. Terim önce sözlükte (kategori
 * verilmişse kategorisi de eşleşmeli), kategorisiz ise ardından aktörlerde aranır.
 * Her kullanım senaryosunda geçen sözlük terimleri ayrıca toplanır.
 */
public final class KeywordResolver {

    static final Pattern KEYWORD = Pattern.compile("\\$\\{\\s*([^}/]+?)\\s*(?:/\\s*([^}]+?)\\s*)?}");

    private final GlossaryCatalog glossaries;
    private final Map<String, Actor> actors;
    private final String replacementFormat;

    private Set<Glossary> collecting;

    public KeywordResolver(GlossaryCatalog glossaries, List<Actor> actors, String replacementFormat) {
        this.glossaries = glossaries;
        this.actors = new LinkedHashMap<>();
        actors.forEach(a -> this.actors.put(a.id(), a));
        this.replacementFormat = replacementFormat;
    }

    /**
     * Çözümlenmiş ağaç ve kullanım senaryosu başına geçen sözlük terimleri.
     */
    public record Resolution(AppProps props, Map<String, List<Glossary>> glossariesByUseCase) {
    }

    public Resolution resolve(AppProps app) {
        ParserContext ctx = new ParserContext();
        Map<String, List<Glossary>> used = new LinkedHashMap<>();

        ctx.push("usecases");
        Map<String, UseCaseProps> useCases = new LinkedHashMap<>();
        for (var entry : app.usecases().entrySet()) {
            ctx.push(entry.getKey());
            collecting = new LinkedHashSet<>();
            useCases.put(entry.getKey(), useCase(ctx, entry.getValue()));
            used.put(entry.getKey(), List.copyOf(collecting));
            collecting = null;
            ctx.pop();
        }
        ctx.pop();

        Map<String, ScenarioProps> scenarios = each(ctx, "scenarios", app.scenarios(),
                (c, s) -> new ScenarioProps(text(c, "name", s.name()), text(c, "summary", s.summary()), s.usecaseOrder()));

        return new Resolution(new AppProps(app.actors(), app.glossaries(), app.factors(), useCases, scenarios), used);
    }

    private UseCaseProps useCase(ParserContext ctx, UseCaseProps uc) {
        return new UseCaseProps(
                text(ctx, "name", uc.name()),
                text(ctx, "summary", uc.summary()),
                each(ctx, "preConditions", uc.preConditions(), this::condition),
                each(ctx, "postConditions", uc.postConditions(), this::condition),
                each(ctx, "basicFlows", uc.basicFlows(), this::flow),
                each(ctx, "alternateFlows", uc.alternateFlows(), this::branch),
                each(ctx, "exceptionFlows", uc.exceptionFlows(), this::branch),
                each(ctx, "valiations", uc.valiations(), this::variation));
    }

    private ConditionProps condition(ParserContext ctx, ConditionProps c) {
        return new ConditionProps(text(ctx, "description", c.description()),
                each(ctx, "details", c.details(), this::condition));
    }

    private FlowProps flow(ParserContext ctx, FlowProps f) {
        return new FlowProps(f.playerId(), text(ctx, "description", f.description()));
    }

    private BranchProps branch(ParserContext ctx, BranchProps b) {
        return new BranchProps(text(ctx, "description", b.description()),
                each(ctx, "override", b.override(), (c, o) -> new OverrideProps(
                        each(c, "replaceFlows", o.replaceFlows(), this::flow), o.returnFlowId())));
    }

    private VariationProps variation(ParserContext ctx, VariationProps v) {
        return new VariationProps(text(ctx, "description", v.description()), v.factorEntryPoints(),
                v.pictConstraint(), each(ctx, "results", v.results(), (c, r) -> new ResultProps(
                        text(c, "description", r.description()), r.order(), r.arrow(), r.disarrow(),
                        r.verificationPointIds())));
    }

    private <T> Map<String, T> each(ParserContext ctx, String key, Map<String, T> source,
                                    BiFunction<ParserContext, T, T> visitor) {
        if (source == null) {
            return Map.of();
        }
        ctx.push(key);
        Map<String, T> result = new LinkedHashMap<>();
        for (var entry : source.entrySet()) {
            ctx.push(entry.getKey());
            result.put(entry.getKey(), visitor.apply(ctx, entry.getValue()));
            ctx.pop();
        }
        ctx.pop();
        return result;
    }

    private String text(ParserContext ctx, String field, String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        ctx.push(field);
        Matcher matcher = KEYWORD.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String category = matcher.group(2) == null ? null : matcher.group(1);
            String term = matcher.group(2) == null ? matcher.group(1) : matcher.group(2);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(String.format(replacementFormat, lookup(ctx, category, term))));
        }
        matcher.appendTail(sb);
        ctx.pop();
        return sb.toString();
    }

    private String lookup(ParserContext ctx, String category, String term) {
        var glossary = glossaries.find(term, category);
        if (glossary.isPresent()) {
            if (collecting != null) {
                collecting.add(glossary.get());
            }
            return glossary.get().id();
        }
        if (category == null && actors.containsKey(term)) {
            return actors.get(term).id();
        }
        String keyword = category == null ? term : category + "/" + term;
        throw ctx.structural("anahtar kelime sözlükte tanımlı değil: ${" + keyword + "}");
    }
}
