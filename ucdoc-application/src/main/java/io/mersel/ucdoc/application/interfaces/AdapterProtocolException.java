package io.mersel.ucdoc.application.interfaces;

/**
 * Kombinasyon üreticisinin hatalı çıktı vermesi veya çalıştırılamaması.
 * <p>
 * Tanım hatası değil ortam hatasıdır; yeniden denenmez.
 */
public class AdapterProtocolException extends RuntimeException {

    public AdapterProtocolException(String message) {
        super(message);
    }

    public AdapterProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
