package io.mersel.ucdoc.application.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ekleme sırasını koruyan, değer eşitliğiyle tekrarsız (faktör, seviye) kümesi.
 * <p>
 * Varyasyon sonuçlarının arrow/disarrow filtreleri bu küme üzerinde uygulanır.
 */
public final class FactorLevelChoiceSet implements Iterable<FactorLevelChoice> {

    private final List<FactorLevelChoice> choices = new ArrayList<>();

    public FactorLevelChoiceSet() {
    }

    public FactorLevelChoiceSet(Collection<FactorLevelChoice> initial) {
        initial.forEach(this::add);
    }

    /**
     * Verilen faktörlerin tüm seviyelerini içeren küme.
     */
    public static FactorLevelChoiceSet allOf(Collection<Factor> factors) {
        FactorLevelChoiceSet set = new FactorLevelChoiceSet();
        for (Factor factor : factors) {
            set.addAll(factor);
        }
        return set;
    }

    /**
     * @return Eleman eklendiyse true, zaten varsa false
     */
    public boolean add(FactorLevelChoice choice) {
        if (choices.contains(choice)) {
            return false;
        }
        return choices.add(choice);
    }

    public void addAll(Factor factor) {
        for (FactorLevel level : factor.levels()) {
            add(new FactorLevelChoice(factor.id(), level));
        }
    }

    public void addAll(Iterable<FactorLevelChoice> other) {
        other.forEach(this::add);
    }

    public boolean remove(FactorLevelChoice choice) {
        return choices.remove(choice);
    }

    public boolean contains(FactorLevelChoice choice) {
        return choices.contains(choice);
    }

    public boolean containsAll(Iterable<FactorLevelChoice> other) {
        for (FactorLevelChoice choice : other) {
            if (!choices.contains(choice)) {
                return false;
            }
        }
        return true;
    }

    /**
     * İzin listesinde olmayan her seçimi çıkarır.
     * Her çıkarmadan sonra tarama baştan başlar; kararlı duruma gelince biter.
     */
    public void arrow(FactorLevelChoiceSet allowed) {
        boolean removed = true;
        while (removed) {
            removed = false;
            for (FactorLevelChoice choice : choices) {
                if (!allowed.contains(choice)) {
                    choices.remove(choice);
                    removed = true;
                    break;
                }
            }
        }
    }

    /**
     * Yasak listesindeki her seçimi çıkarır.
     */
    public void disarrow(FactorLevelChoiceSet denied) {
        boolean removed = true;
        while (removed) {
            removed = false;
            for (FactorLevelChoice choice : choices) {
                if (denied.contains(choice)) {
                    choices.remove(choice);
                    removed = true;
                    break;
                }
            }
        }
    }

    /**
     * Kümede gerçekten kullanılan seviyelerle yeniden oluşturulmuş faktörler.
     * Faktör sırası ilk geçiş sırasıdır; seviye sırası faktörün tanım sırasıdır.
     *
     * @param factorLookup Faktör id → tanımlı faktör
     */
    public List<Factor> regenerateFactors(Function<String, Optional<Factor>> factorLookup) {
        Map<String, List<FactorLevel>> used = new LinkedHashMap<>();
        for (FactorLevelChoice choice : choices) {
            used.computeIfAbsent(choice.factorId(), k -> new ArrayList<>()).add(choice.level());
        }
        List<Factor> result = new ArrayList<>();
        for (var entry : used.entrySet()) {
            Factor declared = factorLookup.apply(entry.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Bilinmeyen faktör: " + entry.getKey()));
            List<FactorLevel> levels = declared.levels().stream()
                    .filter(entry.getValue()::contains)
                    .toList();
            result.add(declared.withLevels(levels));
        }
        return result;
    }

    public FactorLevelChoiceSet copy() {
        return new FactorLevelChoiceSet(choices);
    }

    public List<FactorLevelChoice> toList() {
        return List.copyOf(choices);
    }

    public int size() {
        return choices.size();
    }

    public boolean isEmpty() {
        return choices.isEmpty();
    }

    @Override
    public Iterator<FactorLevelChoice> iterator() {
        return toList().iterator();
    }

    @Override
    public String toString() {
        return choices.toString();
    }
}
