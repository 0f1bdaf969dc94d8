package io.mersel.ucdoc.application.interfaces;

/**
 * Bir kullanım senaryosu içinde aynı id'nin iki kez tanımlanması.
 */
public class UniquenessViolationException extends SpecException {

    private final String duplicateId;

    public UniquenessViolationException(String path, String duplicateId) {
        super(path, "id birden fazla kez tanımlanmış: " + duplicateId);
        this.duplicateId = duplicateId;
    }

    public String getDuplicateId() {
        return duplicateId;
    }
}
