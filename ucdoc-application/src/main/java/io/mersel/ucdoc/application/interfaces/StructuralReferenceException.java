package io.mersel.ucdoc.application.interfaces;

/**
 * Bilinmeyen ya da eksik referans.
 * <p>
 * Tanımsız aktör, akış, faktör, seviye veya doğrulama noktası;
 * boş sonuç listesi gibi yapısal hatalarda fırlatılır.
 */
public class StructuralReferenceException extends SpecException {

    public StructuralReferenceException(String path, String message) {
        super(path, message);
    }
}
