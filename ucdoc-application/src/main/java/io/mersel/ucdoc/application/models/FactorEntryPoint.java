package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.interfaces.DuplicateFactorBindingException;
import io.mersel.ucdoc.application.interfaces.StructuralReferenceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Faktör → giriş noktası bağlaması.
 * <p>
 * Her faktör en fazla bir giriş noktasına bağlıdır; bir giriş noktası birden
 * fazla faktör taşıyabilir. Tüm haritalar id ile anahtarlanır. Faktör sırası
 * bağlama sırasıdır ve kombinasyon üretiminde sütun sırası olarak kullanılır.
 * <p>
 * Faktör başına bir "omit" defteri tutulur: seviyeler faktörü silmeden geçici
 * olarak üretimden çıkarılabilir. Bir faktörün tüm seviyeleri çıkarıldığında
 * faktör bağlamadan düşer.
 */
public final class FactorEntryPoint {

    private final Map<String, EntryPoint> entryPoints = new LinkedHashMap<>();
    private final Map<String, Factor> factors = new LinkedHashMap<>();
    private final Map<String, String> entryPointIdByFactorId = new LinkedHashMap<>();
    private final Map<String, List<String>> factorIdsByEntryPointId = new LinkedHashMap<>();
    private final Map<String, Set<FactorLevel>> omitted = new LinkedHashMap<>();

    /**
     * Faktörleri giriş noktasına bağlar.
     *
     * @throws DuplicateFactorBindingException Faktörlerden biri zaten bağlıysa
     */
    public void add(EntryPoint entryPoint, Collection<Factor> newFactors) {
        Set<String> seen = new LinkedHashSet<>();
        for (Factor factor : newFactors) {
            String bound = entryPointIdByFactorId.get(factor.id());
            if (bound != null) {
                throw new DuplicateFactorBindingException(factor.id(), bound);
            }
            if (!seen.add(factor.id())) {
                throw new DuplicateFactorBindingException(factor.id(), entryPoint.id());
            }
        }
        entryPoints.putIfAbsent(entryPoint.id(), entryPoint);
        List<String> ids = factorIdsByEntryPointId.computeIfAbsent(entryPoint.id(), k -> new ArrayList<>());
        for (Factor factor : newFactors) {
            factors.put(factor.id(), factor);
            entryPointIdByFactorId.put(factor.id(), entryPoint.id());
            ids.add(factor.id());
        }
    }

    public Optional<EntryPoint> getEntryPointByFactor(String factorId) {
        return Optional.ofNullable(entryPointIdByFactorId.get(factorId)).map(entryPoints::get);
    }

    public List<Factor> getFactorsByEntryPoint(String entryPointId) {
        return factorIdsByEntryPointId.getOrDefault(entryPointId, List.of()).stream()
                .map(factors::get)
                .toList();
    }

    public Optional<Factor> getFactor(String factorId) {
        return Optional.ofNullable(factors.get(factorId));
    }

    /**
     * Faktörü ve omit defterini siler. Boş kalan giriş noktası da düşer.
     */
    public void removeFactor(String factorId) {
        String entryPointId = entryPointIdByFactorId.remove(factorId);
        if (entryPointId == null) {
            return;
        }
        factors.remove(factorId);
        omitted.remove(factorId);
        List<String> ids = factorIdsByEntryPointId.get(entryPointId);
        ids.remove(factorId);
        if (ids.isEmpty()) {
            factorIdsByEntryPointId.remove(entryPointId);
            entryPoints.remove(entryPointId);
        }
    }

    /**
     * Yalnızca verilen faktörleri içeren yeni bağlama üretir.
     * Verilen faktör nesneleri (örn. daraltılmış seviyelerle) id ile eşleşen bağlı faktörün yerini alır.
     *
     * @throws StructuralReferenceException Faktörlerden biri bu bağlamada yoksa
     */
    public FactorEntryPoint regenerateFromFactors(Collection<Factor> subset) {
        Map<String, Factor> wanted = new LinkedHashMap<>();
        for (Factor factor : subset) {
            if (!factors.containsKey(factor.id())) {
                throw new StructuralReferenceException("factorEntryPoints",
                        "faktör bu bağlamada tanımlı değil: " + factor.id());
            }
            wanted.put(factor.id(), factor);
        }
        FactorEntryPoint regenerated = new FactorEntryPoint();
        for (var entry : factorIdsByEntryPointId.entrySet()) {
            List<Factor> kept = entry.getValue().stream()
                    .filter(wanted::containsKey)
                    .map(wanted::get)
                    .toList();
            if (!kept.isEmpty()) {
                regenerated.add(entryPoints.get(entry.getKey()), kept);
            }
        }
        return regenerated;
    }

    /**
     * Seviyeyi üretimden çıkarır. Faktörün tüm seviyeleri çıkarılmışsa faktör silinir.
     */
    public void omitLevel(FactorLevelChoice choice) {
        Factor factor = factors.get(choice.factorId());
        if (factor == null || !factor.hasLevel(choice.level())) {
            return;
        }
        Set<FactorLevel> levels = omitted.computeIfAbsent(choice.factorId(), k -> new LinkedHashSet<>());
        levels.add(choice.level());
        if (levels.containsAll(factor.levels())) {
            removeFactor(choice.factorId());
        }
    }

    /**
     * @return Omit defteri düşüldükten sonra kalan seviyeler, tanım sırasıyla
     */
    public List<FactorLevel> getEffectiveLevels(String factorId) {
        Factor factor = factors.get(factorId);
        if (factor == null) {
            return List.of();
        }
        Set<FactorLevel> skip = omitted.getOrDefault(factorId, Set.of());
        return factor.levels().stream().filter(l -> !skip.contains(l)).toList();
    }

    public FactorEntryPoint copy() {
        FactorEntryPoint copy = new FactorEntryPoint();
        for (var entry : factorIdsByEntryPointId.entrySet()) {
            copy.add(entryPoints.get(entry.getKey()), entry.getValue().stream().map(factors::get).toList());
        }
        omitted.forEach((factorId, levels) -> copy.omitted.put(factorId, new LinkedHashSet<>(levels)));
        return copy;
    }

    public List<Factor> getFactors() {
        return List.copyOf(factors.values());
    }

    public List<EntryPoint> getEntryPoints() {
        return List.copyOf(entryPoints.values());
    }

    public boolean isEmpty() {
        return factors.isEmpty();
    }
}
