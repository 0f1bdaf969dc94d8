package io.mersel.ucdoc.application.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Kategorilere ayrılmış sözlük terimleri.
 */
public final class GlossaryCatalog {

    private final List<Glossary> glossaries;
    private final Map<String, List<Glossary>> byCategory;

    public GlossaryCatalog(List<Glossary> glossaries) {
        this.glossaries = List.copyOf(glossaries);
        Map<String, List<Glossary>> grouped = new LinkedHashMap<>();
        for (Glossary glossary : glossaries) {
            grouped.computeIfAbsent(glossary.category(), k -> new ArrayList<>()).add(glossary);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        this.byCategory = Map.copyOf(grouped);
    }

    public static GlossaryCatalog empty() {
        return new GlossaryCatalog(List.of());
    }

    /**
     * Terimi bulur. Kategori verilmişse eşleşmesi de gerekir.
     *
     * @param id       Terim id'si
     * @param category Kategori veya null
     */
    public Optional<Glossary> find(String id, String category) {
        return glossaries.stream()
                .filter(g -> g.id().equals(id))
                .filter(g -> category == null || g.category().equals(category))
                .findFirst();
    }

    public List<Glossary> getByCategory(String category) {
        return byCategory.getOrDefault(category, List.of());
    }

    public List<String> getCategories() {
        return glossaries.stream().map(Glossary::category).distinct().toList();
    }

    public List<Glossary> getAll() {
        return glossaries;
    }
}
