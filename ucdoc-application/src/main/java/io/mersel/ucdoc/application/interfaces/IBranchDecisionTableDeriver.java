package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.models.AltExFlow;
import io.mersel.ucdoc.application.models.BranchDecisionTable;
import io.mersel.ucdoc.application.models.Variation;

import java.util.Optional;

/**
 * Tek bir dalı hedefleyen sonuçlar için daraltılmış alt karar tablosu türetir.
 */
public interface IBranchDecisionTableDeriver {

    /**
     * @return Dalı hedefleyen sonuç yoksa boş
     */
    Optional<BranchDecisionTable> derive(Variation variation, AltExFlow branch);
}
