package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.PlayerKind;

import java.util.Objects;

/**
 * Sözlük terimi.
 * <p>
 * Ad verilmezse id, açıklama verilmezse ad kullanılır.
 *
 * @param id          Terim id'si
 * @param category    Kategori
 * @param name        Görünen ad
 * @param description Açıklama
 * @param url         Opsiyonel bağlantı (null olabilir)
 */
public record Glossary(String id, String category, String name, String description, String url) implements Player {

    public Glossary {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        name = name == null || name.isBlank() ? id : name;
        description = description == null || description.isBlank() ? name : description;
    }

    @Override
    public String text() {
        return description;
    }

    @Override
    public PlayerKind kind() {
        return PlayerKind.GLOSSARY;
    }
}
