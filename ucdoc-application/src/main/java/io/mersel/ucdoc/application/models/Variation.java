package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.interfaces.StructuralReferenceException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Varyasyon: faktör bağlaması, üretilmiş kombinasyon ve en az bir sonuç.
 */
public record Variation(String id, String description, FactorEntryPoint binding,
                        PictCombination combination, List<VariationResult> results) {

    public Variation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(combination, "combination");
        description = description == null ? "" : description;
        binding = binding.copy();
        results = List.copyOf(results);
        if (results.isEmpty()) {
            throw new StructuralReferenceException("valiations." + id + ".results",
                    "en az bir sonuç tanımlanmalı");
        }
    }

    @Override
    public FactorEntryPoint binding() {
        return binding.copy();
    }

    public Optional<VariationResult> findResult(String resultId) {
        return results.stream().filter(r -> r.id().equals(resultId)).findFirst();
    }
}
