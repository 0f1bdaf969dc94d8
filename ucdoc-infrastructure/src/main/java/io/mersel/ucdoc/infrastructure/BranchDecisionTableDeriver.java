package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.interfaces.ICombinationGenerator;
import io.mersel.ucdoc.application.interfaces.IBranchDecisionTableDeriver;
import io.mersel.ucdoc.application.interfaces.IDecisionTableBuilder;
import io.mersel.ucdoc.application.models.AltExFlow;
import io.mersel.ucdoc.application.models.BranchDecisionTable;
import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.FactorEntryPoint;
import io.mersel.ucdoc.application.models.FactorLevel;
import io.mersel.ucdoc.application.models.FactorLevelChoice;
import io.mersel.ucdoc.application.models.FactorLevelChoiceSet;
import io.mersel.ucdoc.application.models.PictCombination;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VariationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Dal alt karar tablosu türetici.
 * <p>
 * Tüm doğrulama noktaları verilen dalı hedefleyen sonuçlar seçilir. Bağlama,
 * bu sonuçların seçim birleşiminde geçen faktörlere daraltılır; birleşimde
 * geçmeyen seviyeler omit defterine yazılır. Daraltılmış bağlama için yeni
 * kombinasyon üretilir ve yalnızca seçilen sonuçlarla karar tablosu kurulur.
 */
@Service
public class BranchDecisionTableDeriver implements IBranchDecisionTableDeriver {

    private static final Logger log = LoggerFactory.getLogger(BranchDecisionTableDeriver.class);

    private final ICombinationGenerator generator;
    private final IDecisionTableBuilder builder;

    public BranchDecisionTableDeriver(ICombinationGenerator generator, IDecisionTableBuilder builder) {
        this.generator = generator;
        this.builder = builder;
    }

    @Override
    public Optional<BranchDecisionTable> derive(Variation variation, AltExFlow branch) {
        List<VariationResult> results = variation.results().stream()
                .filter(r -> r.verifiesOnly(branch.id()))
                .toList();
        if (results.isEmpty()) {
            return Optional.empty();
        }

        FactorLevelChoiceSet union = new FactorLevelChoiceSet();
        results.forEach(r -> union.addAll(r.choices()));

        FactorEntryPoint binding = variation.binding();
        List<Factor> usedFactors = union.regenerateFactors(binding::getFactor).stream()
                .map(reduced -> binding.getFactor(reduced.id()).orElseThrow())
                .toList();
        FactorEntryPoint scoped = binding.regenerateFromFactors(usedFactors);
        for (Factor factor : scoped.getFactors()) {
            for (FactorLevel level : factor.levels()) {
                FactorLevelChoice choice = new FactorLevelChoice(factor.id(), level);
                if (!union.contains(choice)) {
                    scoped.omitLevel(choice);
                }
            }
        }

        // Sütun konumları değiştiği için varyasyonun kısıt metni alt tabloya taşınmaz.
        PictCombination combination = generator.generate(scoped, "");
        log.debug("  {} / {} alt tablosu: {} faktör, {} kural",
                variation.id(), branch.id(), scoped.getFactors().size(), combination.getRuleCount());
        return Optional.of(new BranchDecisionTable(variation.id(), branch, combination,
                builder.build(variation.id(), combination, results)));
    }
}
