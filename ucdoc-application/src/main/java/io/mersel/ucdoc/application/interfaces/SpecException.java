package io.mersel.ucdoc.application.interfaces;

/**
 * Kullanım senaryosu tanımındaki hataların ortak üst sınıfı.
 * <p>
 * Hatanın tanım içindeki konumu noktalı yol olarak taşınır
 * (örn. {@code usecases.UC01.basicFlows.B01.playerId}).
 * Tüm alt sınıflar ölümcüldür: yükleme yarım kalan bir model döndürmeden durur.
 */
public class SpecException extends RuntimeException {

    private final String path;

    public SpecException(String path, String message) {
        super(path == null || path.isEmpty() ? message : path + ": " + message);
        this.path = path == null ? "" : path;
    }

    public SpecException(String path, String message, Throwable cause) {
        super(path == null || path.isEmpty() ? message : path + ": " + message, cause);
        this.path = path == null ? "" : path;
    }

    /**
     * @return Hatanın noktalı yolu, bilinmiyorsa boş metin
     */
    public String getPath() {
        return path;
    }
}
