package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.models.FactorEntryPoint;
import io.mersel.ucdoc.application.models.PictCombination;

/**
 * Faktör seviyelerinin kombinatoryal (pairwise) kapsamasını üreten dış bileşen arayüzü.
 */
public interface ICombinationGenerator {

    /**
     * Bağlı faktörlerin etkin seviyeleri için kapsama üretir.
     * <p>
     * Faktör listesi boşsa harici süreç çağrılmaz ve 0 kurallı kombinasyon döner.
     *
     * @param binding    Faktör → giriş noktası bağlaması (faktör sırası korunur)
     * @param constraint Üreticiye aynen iletilen kısıt metni (boş olabilir)
     * @return Her faktör için kural sayısı uzunluğunda seviye listesi
     * @throws AdapterProtocolException Üretici çalıştırılamadığında veya çıktı bozuk olduğunda
     */
    PictCombination generate(FactorEntryPoint binding, String constraint);
}
