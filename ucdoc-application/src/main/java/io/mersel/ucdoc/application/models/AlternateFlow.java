package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.BranchKind;
import io.mersel.ucdoc.application.enums.VerificationPointKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Alternatif akış. İç içe akışlardan sonra {@code returnFlow} adımından devam eder.
 */
public record AlternateFlow(String id, String description, List<Flow> sourceFlows,
                            List<Flow> nextFlows, Flow returnFlow) implements AltExFlow {

    public AlternateFlow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(returnFlow, "returnFlow");
        description = description == null ? "" : description;
        sourceFlows = List.copyOf(sourceFlows);
        nextFlows = List.copyOf(nextFlows);
    }

    @Override
    public BranchKind branchKind() {
        return BranchKind.ALTERNATE;
    }

    @Override
    public Optional<Flow> resumeAt() {
        return Optional.of(returnFlow);
    }

    @Override
    public VerificationPointKind verificationPointKind() {
        return VerificationPointKind.ALTERNATE_FLOW;
    }
}
