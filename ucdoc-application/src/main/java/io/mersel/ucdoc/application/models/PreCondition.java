package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.EntryPointKind;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Ön koşul. Alt detaylar aynı türden iç içe ön koşullardır.
 */
public record PreCondition(String id, String description, List<PreCondition> details) implements EntryPoint {

    public PreCondition {
        Objects.requireNonNull(id, "id");
        description = description == null ? "" : description;
        details = details == null ? List.of() : List.copyOf(details);
    }

    /**
     * @return Kendisi ve tüm alt detaylar, derinlik öncelikli tanım sırasıyla
     */
    public Stream<PreCondition> flatten() {
        return Stream.concat(Stream.of(this), details.stream().flatMap(PreCondition::flatten));
    }

    @Override
    public EntryPointKind entryPointKind() {
        return EntryPointKind.PRE_CONDITION;
    }
}
