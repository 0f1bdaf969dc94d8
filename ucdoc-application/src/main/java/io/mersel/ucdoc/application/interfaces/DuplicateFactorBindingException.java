package io.mersel.ucdoc.application.interfaces;

/**
 * Bir faktörün ikinci bir giriş noktasına bağlanmaya çalışılması.
 */
public class DuplicateFactorBindingException extends SpecException {

    public DuplicateFactorBindingException(String factorId, String boundEntryPointId) {
        this("", factorId, boundEntryPointId);
    }

    public DuplicateFactorBindingException(String path, String factorId, String boundEntryPointId) {
        super(path, "faktör zaten bağlı: " + factorId + " (giriş noktası: " + boundEntryPointId + ")");
    }
}
