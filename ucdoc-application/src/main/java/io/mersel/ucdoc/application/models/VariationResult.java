package io.mersel.ucdoc.application.models;

import java.util.List;
import java.util.Objects;

/**
 * Varyasyon sonucu: arrow/disarrow uygulandıktan sonra kalan seçimler
 * ve bu seçimlerle doğrulanan hedefler.
 *
 * @param id                 Sonuç id'si
 * @param description        Açıklama
 * @param choices            Çözümlenmiş (faktör, seviye) seçimleri
 * @param verificationPoints En az bir doğrulama noktası
 */
public record VariationResult(String id, String description, List<FactorLevelChoice> choices,
                              List<VerificationPoint> verificationPoints) {

    public VariationResult {
        Objects.requireNonNull(id, "id");
        description = description == null ? "" : description;
        choices = List.copyOf(choices);
        verificationPoints = List.copyOf(verificationPoints);
    }

    public FactorLevelChoiceSet choiceSet() {
        return new FactorLevelChoiceSet(choices);
    }

    /**
     * @return Tüm doğrulama noktaları verilen id'yi hedefliyorsa true
     */
    public boolean verifiesOnly(String verificationPointId) {
        return !verificationPoints.isEmpty()
                && verificationPoints.stream().allMatch(vp -> vp.id().equals(verificationPointId));
    }
}
