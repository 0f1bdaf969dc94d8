package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.VerificationPointKind;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Son koşul. Detaylı bir son koşul, tüm detayları kapsandığında ve
 * kendisi de doğrulandığında kapsanmış sayılır (bkz. {@link CoverageLedger}).
 */
public record PostCondition(String id, String description, List<PostCondition> details) implements VerificationPoint {

    public PostCondition {
        Objects.requireNonNull(id, "id");
        description = description == null ? "" : description;
        details = details == null ? List.of() : List.copyOf(details);
    }

    public Stream<PostCondition> flatten() {
        return Stream.concat(Stream.of(this), details.stream().flatMap(PostCondition::flatten));
    }

    public boolean hasDetails() {
        return !details.isEmpty();
    }

    @Override
    public VerificationPointKind verificationPointKind() {
        return VerificationPointKind.POST_CONDITION;
    }
}
