package io.mersel.ucdoc.application.interfaces;

import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.models.SpecLoadResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * YAML tanım dosyalarını doğrulanmış modele dönüştürür.
 */
public interface IUseCaseSpecLoader {

    /**
     * Dosyaları sırayla birleştirir, modeli kurar, karar tablolarını üretir ve kapsamı doğrular.
     *
     * @param files Tanım dosyaları (sonraki dosya öncekini ezer)
     * @param mode  Kapsam doğrulama kipi
     * @return Katalog, karar tabloları ve esnek kip uyarıları
     * @throws IOException   Dosya okunamadığında
     * @throws SpecException Tanım hatalı olduğunda
     */
    SpecLoadResult load(List<Path> files, ValidationMode mode) throws IOException;
}
