package io.mersel.ucdoc.infrastructure.yaml;

import java.util.HashSet;
import java.util.Set;

/**
 * Tek bir kullanım senaryosu kapsamında id tekilliği.
 * <p>
 * Ön/son koşullar (her derinlikte), temel ve iç içe akışlar, alternatif/istisna
 * akışları, varyasyonlar ve sonuçlar aynı kayda yazılır.
 */
final class IdRegistry {

    private final Set<String> ids = new HashSet<>();

    /**
     * @throws io.mersel.ucdoc.application.interfaces.UniquenessViolationException Id daha önce kaydedildiyse
     */
    void register(ParserContext ctx, String id) {
        if (!ids.add(id)) {
            throw ctx.duplicate(id);
        }
    }
}
