package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.application.enums.FilterOrder;
import io.mersel.ucdoc.application.interfaces.DuplicateFactorBindingException;
import io.mersel.ucdoc.application.interfaces.ICombinationGenerator;
import io.mersel.ucdoc.application.models.EntryPoint;
import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.FactorEntryPoint;
import io.mersel.ucdoc.application.models.FactorLevel;
import io.mersel.ucdoc.application.models.FactorLevelChoice;
import io.mersel.ucdoc.application.models.FactorLevelChoiceSet;
import io.mersel.ucdoc.application.models.PictCombination;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VariationResult;
import io.mersel.ucdoc.application.models.VerificationPoint;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ResultProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.VariationProps;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Varyasyon kurucu.
 * <p>
 * Faktörleri giriş noktalarına bağlar, her sonucun seçim kümesini arrow/disarrow
 * filtreleriyle çözümler, doğrulama noktalarını bağlar ve kombinasyonu üretir.
 */
@Component
public class VariationAssembler {

    private final ICombinationGenerator generator;

    public VariationAssembler(ICombinationGenerator generator) {
        this.generator = generator;
    }

    /**
     * @param entryPoints        Ön koşullar (her derinlikte) ve temel akışlar, id ile
     * @param factors            Tanımlı tüm faktörler, id ile
     * @param verificationPoints Son koşullar (her derinlikte), alternatif ve istisna akışları, id ile
     */
    Variation assemble(ParserContext ctx, String id, VariationProps props, Map<String, EntryPoint> entryPoints,
                       Map<String, Factor> factors, Map<String, VerificationPoint> verificationPoints,
                       IdRegistry ids) {
        FactorEntryPoint binding = bind(ctx, props.factorEntryPoints(), entryPoints, factors);

        ctx.push("results");
        List<VariationResult> results = new ArrayList<>();
        for (var entry : props.results().entrySet()) {
            ctx.push(entry.getKey());
            ids.register(ctx, entry.getKey());
            results.add(result(ctx, entry.getKey(), entry.getValue(), binding, verificationPoints));
            ctx.pop();
        }
        ctx.pop();

        PictCombination combination = generator.generate(binding, props.pictConstraint());
        return new Variation(id, props.description(), binding, combination, results);
    }

    private FactorEntryPoint bind(ParserContext ctx, Map<String, List<String>> declared,
                                  Map<String, EntryPoint> entryPoints, Map<String, Factor> factors) {
        FactorEntryPoint binding = new FactorEntryPoint();
        ctx.push("factorEntryPoints");
        for (var entry : declared.entrySet()) {
            ctx.push(entry.getKey());
            EntryPoint entryPoint = entryPoints.get(entry.getKey());
            if (entryPoint == null) {
                throw ctx.structural("preConditions veya basicFlows içinde tanımlı değil: " + entry.getKey());
            }
            List<Factor> bound = new ArrayList<>();
            for (String factorId : entry.getValue()) {
                Factor factor = factors.get(factorId);
                if (factor == null) {
                    throw ctx.push(factorId).structural("factors içinde tanımlı değil: " + factorId);
                }
                var existing = binding.getEntryPointByFactor(factorId);
                if (existing.isPresent() || bound.contains(factor)) {
                    throw new DuplicateFactorBindingException(ctx.path(), factorId,
                            existing.map(EntryPoint::id).orElse(entry.getKey()));
                }
                bound.add(factor);
            }
            binding.add(entryPoint, bound);
            ctx.pop();
        }
        ctx.pop();
        return binding;
    }

    private VariationResult result(ParserContext ctx, String id, ResultProps props, FactorEntryPoint binding,
                                   Map<String, VerificationPoint> verificationPoints) {
        FactorLevelChoiceSet choices = FactorLevelChoiceSet.allOf(binding.getFactors());
        FactorLevelChoiceSet arrows = props.arrow() == null
                ? choices.copy()
                : choiceSet(ctx, "arrow", props.arrow(), binding);
        FactorLevelChoiceSet disarrows = props.disarrow() == null
                ? new FactorLevelChoiceSet()
                : choiceSet(ctx, "disarrow", props.disarrow(), binding);

        FilterOrder order;
        try {
            order = FilterOrder.fromKey(props.order());
        } catch (IllegalArgumentException e) {
            throw ctx.push("order").structural(e.getMessage());
        }
        switch (order) {
            case ARROW_FIRST -> {
                choices.arrow(arrows);
                choices.disarrow(disarrows);
            }
            case DISARROW_FIRST -> {
                choices.disarrow(disarrows);
                choices.arrow(arrows);
            }
        }

        ctx.push("verificationPointIds");
        List<VerificationPoint> points = new ArrayList<>();
        for (String pointId : props.verificationPointIds()) {
            VerificationPoint point = verificationPoints.get(pointId);
            if (point == null) {
                throw ctx.structural(pointId + " postConditions, alternateFlows veya exceptionFlows içinde tanımlı değil");
            }
            points.add(point);
        }
        ctx.pop();

        return new VariationResult(id, props.description(), choices.toList(), points);
    }

    private FactorLevelChoiceSet choiceSet(ParserContext ctx, String key, Map<String, List<String>> declared,
                                           FactorEntryPoint binding) {
        FactorLevelChoiceSet set = new FactorLevelChoiceSet();
        ctx.push(key);
        for (var entry : declared.entrySet()) {
            ctx.push(entry.getKey());
            Factor factor = binding.getFactor(entry.getKey())
                    .orElseThrow(() -> ctx.structural("faktör bu varyasyonda bağlı değil: " + entry.getKey()));
            for (String level : entry.getValue()) {
                FactorLevel factorLevel = new FactorLevel(level);
                if (!factor.hasLevel(factorLevel)) {
                    throw ctx.push(level).structural(level + " factors." + factor.id() + ".items içinde tanımlı değil");
                }
                set.add(new FactorLevelChoice(factor.id(), factorLevel));
            }
            ctx.pop();
        }
        ctx.pop();
        return set;
    }
}
