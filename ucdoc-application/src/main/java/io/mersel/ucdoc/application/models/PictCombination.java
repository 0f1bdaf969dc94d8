package io.mersel.ucdoc.application.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kombinasyon üreticisinin çıktısı.
 * <p>
 * Her faktör için kural sayısı uzunluğunda seviye listesi tutar; {@code levels.get(f).get(i)}
 * (i+1). kuralda f faktörünün aldığı seviyedir. Bağlamanın bir kopyası saklanır,
 * sonradan yapılan değişiklikler kombinasyonu etkilemez.
 */
public final class PictCombination {

    private final FactorEntryPoint binding;
    private final String constraint;
    private final Map<String, List<FactorLevel>> levelsByFactorId;
    private final int ruleCount;

    public PictCombination(FactorEntryPoint binding, String constraint, Map<String, List<FactorLevel>> levelsByFactorId) {
        this.binding = binding.copy();
        this.constraint = constraint == null ? "" : constraint;
        Map<String, List<FactorLevel>> copy = new LinkedHashMap<>();
        int count = -1;
        for (var entry : levelsByFactorId.entrySet()) {
            if (count >= 0 && entry.getValue().size() != count) {
                throw new IllegalArgumentException("Faktör seviye listeleri eşit uzunlukta olmalı: " + entry.getKey());
            }
            count = entry.getValue().size();
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.levelsByFactorId = copy;
        this.ruleCount = Math.max(count, 0);
    }

    public FactorEntryPoint getBinding() {
        return binding.copy();
    }

    public String getConstraint() {
        return constraint;
    }

    /**
     * @return Faktörler, kapsama sütun sırasıyla
     */
    public List<Factor> getFactors() {
        List<Factor> factors = new ArrayList<>();
        for (String factorId : levelsByFactorId.keySet()) {
            binding.getFactor(factorId).ifPresent(factors::add);
        }
        return factors;
    }

    public List<FactorLevel> getLevels(String factorId) {
        return levelsByFactorId.getOrDefault(factorId, List.of());
    }

    public int getRuleCount() {
        return ruleCount;
    }

    /**
     * @param ruleIndex 0 tabanlı kural indeksi
     * @return Kuralın gerçekleştirdiği (faktör, seviye) seçimleri
     */
    public FactorLevelChoiceSet getRuleChoices(int ruleIndex) {
        FactorLevelChoiceSet set = new FactorLevelChoiceSet();
        levelsByFactorId.forEach((factorId, levels) -> set.add(new FactorLevelChoice(factorId, levels.get(ruleIndex))));
        return set;
    }

    public boolean isEmpty() {
        return ruleCount == 0;
    }
}
