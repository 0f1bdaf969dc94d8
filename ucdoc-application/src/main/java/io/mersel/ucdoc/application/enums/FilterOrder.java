package io.mersel.ucdoc.application.enums;

/**
 * Sonuç seçim kümesine arrow (izin listesi) ve disarrow (yasak listesi)
 * filtrelerinin uygulanma sırası.
 */
public enum FilterOrder {
    ARROW_FIRST("arrow"),
    DISARROW_FIRST("disarrow");

    private final String key;

    FilterOrder(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * YAML'daki {@code order} değerini çözümler. Boş değer {@link #ARROW_FIRST} kabul edilir.
     *
     * @param value "arrow", "disarrow" veya null
     * @return Karşılık gelen sıra
     * @throws IllegalArgumentException Tanınmayan değer
     */
    public static FilterOrder fromKey(String value) {
        if (value == null || value.isBlank()) {
            return ARROW_FIRST;
        }
        for (FilterOrder order : values()) {
            if (order.key.equalsIgnoreCase(value.trim())) {
                return order;
            }
        }
        throw new IllegalArgumentException("Geçersiz order değeri: " + value + " (arrow veya disarrow olmalı)");
    }
}
