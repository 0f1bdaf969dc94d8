package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.enums.ConditionMark;
import io.mersel.ucdoc.application.enums.ResultMark;
import io.mersel.ucdoc.application.interfaces.IDecisionTableBuilder;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.DecisionTable.ConditionRow;
import io.mersel.ucdoc.application.models.DecisionTable.ResultRow;
import io.mersel.ucdoc.application.models.EntryPoint;
import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.FactorEntryPoint;
import io.mersel.ucdoc.application.models.FactorLevel;
import io.mersel.ucdoc.application.models.FactorLevelChoiceSet;
import io.mersel.ucdoc.application.models.PictCombination;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VariationResult;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Kombinasyondan karar tablosu üretir.
 * <p>
 * Koşul satırları: her faktör için kombinasyonda gerçekten geçen seviyeler,
 * faktörün tanım sırasıyla. Sonuç satırları: kuralın gerçekleştirdiği seçimler
 * sonucun seçimlerini kapsıyorsa CHECK.
 */
@Service
public class DecisionTableBuilder implements IDecisionTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(DecisionTableBuilder.class);

    private final UcdocMetrics metrics;

    public DecisionTableBuilder(UcdocMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public DecisionTable build(Variation variation) {
        return build(variation.id(), variation.combination(), variation.results());
    }

    @Override
    public DecisionTable build(String variationId, PictCombination combination, List<VariationResult> results) {
        int ruleCount = combination.getRuleCount();
        FactorEntryPoint binding = combination.getBinding();

        List<ConditionRow> conditionRows = new ArrayList<>();
        for (Factor factor : combination.getFactors()) {
            List<FactorLevel> realized = combination.getLevels(factor.id());
            String entryPointId = binding.getEntryPointByFactor(factor.id()).map(EntryPoint::id).orElse("");
            for (FactorLevel level : factor.levels()) {
                if (!realized.contains(level)) {
                    continue;
                }
                List<ConditionMark> marks = new ArrayList<>(ruleCount);
                for (FactorLevel actual : realized) {
                    marks.add(actual.equals(level) ? ConditionMark.YES : ConditionMark.NONE);
                }
                conditionRows.add(new ConditionRow(factor, level, entryPointId, marks));
            }
        }

        List<FactorLevelChoiceSet> ruleChoices = new ArrayList<>(ruleCount);
        for (int i = 0; i < ruleCount; i++) {
            ruleChoices.add(combination.getRuleChoices(i));
        }

        List<ResultRow> resultRows = new ArrayList<>();
        for (VariationResult result : results) {
            List<ResultMark> marks = new ArrayList<>(ruleCount);
            for (FactorLevelChoiceSet choices : ruleChoices) {
                marks.add(choices.containsAll(result.choices()) ? ResultMark.CHECK : ResultMark.NONE);
            }
            resultRows.add(new ResultRow(result, marks));
        }

        metrics.recordDecisionTable(ruleCount);
        log.debug("  Karar tablosu: {} ({} koşul satırı, {} sonuç, {} kural)",
                variationId, conditionRows.size(), resultRows.size(), ruleCount);
        return new DecisionTable(variationId, ruleCount, conditionRows, resultRows);
    }
}
