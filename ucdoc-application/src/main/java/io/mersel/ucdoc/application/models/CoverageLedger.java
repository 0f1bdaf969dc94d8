package io.mersel.ucdoc.application.models;

import java.util.Set;

/**
 * Kapsam işaret defteri.
 * <p>
 * Bir varyasyon sonucunda doğrulama noktası olarak geçen her varlık id'si
 * işaretlidir. Son koşullar aşağıdan yukarıya VE ile birleştirilir: detaysız
 * son koşul yalnızca işaretliyse, detaylı son koşul tüm detayları kapsanmış
 * ve kendisi de işaretliyse kapsanmıştır.
 */
public final class CoverageLedger {

    private final Set<String> verifiedIds;

    public CoverageLedger(Set<String> verifiedIds) {
        this.verifiedIds = Set.copyOf(verifiedIds);
    }

    public boolean isVerified(String id) {
        return verifiedIds.contains(id);
    }

    public boolean isCovered(PostCondition postCondition) {
        for (PostCondition detail : postCondition.details()) {
            if (!isCovered(detail)) {
                return false;
            }
        }
        return isVerified(postCondition.id());
    }

    public boolean isCovered(AltExFlow branch) {
        return isVerified(branch.id());
    }

    public Set<String> getVerifiedIds() {
        return verifiedIds;
    }
}
