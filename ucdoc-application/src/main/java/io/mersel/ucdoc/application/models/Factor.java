package io.mersel.ucdoc.application.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Test faktörü: sıralı ve tekrarsız seviye listesi.
 *
 * @param id     Faktör id'si
 * @param name   Görünen ad (verilmezse id)
 * @param levels Tanım sırasıyla seviyeler; tekrar eden değerler ilk geçtiği yerde tutulur
 */
public record Factor(String id, String name, List<FactorLevel> levels) {

    public Factor {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
        List<FactorLevel> distinct = new ArrayList<>();
        for (FactorLevel level : levels) {
            if (!distinct.contains(level)) {
                distinct.add(level);
            }
        }
        levels = List.copyOf(distinct);
    }

    public static Factor of(String id, String... levels) {
        return new Factor(id, id, Arrays.stream(levels).map(FactorLevel::new).toList());
    }

    public boolean hasLevel(FactorLevel level) {
        return levels.contains(level);
    }

    /**
     * @return Seviyenin tanım sırasındaki konumu, yoksa -1
     */
    public int indexOf(FactorLevel level) {
        return levels.indexOf(level);
    }

    /**
     * Aynı id ve ad ile seviye listesi değiştirilmiş kopya.
     */
    public Factor withLevels(List<FactorLevel> newLevels) {
        return new Factor(id, name, newLevels);
    }
}
