package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.BranchKind;

import java.util.List;
import java.util.Optional;

/**
 * Temel akıştan ayrılan dal: alternatif veya istisna akışı.
 */
public sealed interface AltExFlow extends VerificationPoint permits AlternateFlow, ExceptionFlow {

    /**
     * @return Dalın başladığı temel akış adımları (tanım sırasıyla)
     */
    List<Flow> sourceFlows();

    /**
     * @return Kaynak adımın yerine çalışan iç içe akışlar
     */
    List<Flow> nextFlows();

    BranchKind branchKind();

    /**
     * @return Alternatif akışın devam ettiği temel adım; istisna akışında boş
     */
    Optional<Flow> resumeAt();

    default boolean startsAt(String flowId) {
        return sourceFlows().stream().anyMatch(f -> f.id().equals(flowId));
    }
}
