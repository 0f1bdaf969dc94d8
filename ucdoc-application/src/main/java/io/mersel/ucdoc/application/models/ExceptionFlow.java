package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.BranchKind;
import io.mersel.ucdoc.application.enums.VerificationPointKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * İstisna akışı. İç içe akışlardan sonra senaryo sona erer.
 */
public record ExceptionFlow(String id, String description, List<Flow> sourceFlows,
                            List<Flow> nextFlows) implements AltExFlow {

    public ExceptionFlow {
        Objects.requireNonNull(id, "id");
        description = description == null ? "" : description;
        sourceFlows = List.copyOf(sourceFlows);
        nextFlows = List.copyOf(nextFlows);
    }

    @Override
    public BranchKind branchKind() {
        return BranchKind.EXCEPTION;
    }

    @Override
    public Optional<Flow> resumeAt() {
        return Optional.empty();
    }

    @Override
    public VerificationPointKind verificationPointKind() {
        return VerificationPointKind.EXCEPTION_FLOW;
    }
}
