package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.EntryPointKind;

import java.util.Objects;

/**
 * Tek bir akış adımı.
 * <p>
 * Dallara ait geri bağlantılar adımın üzerinde değil,
 * kullanım senaryosunun {@link FlowLinks} dizininde tutulur.
 *
 * @param id          Adım id'si
 * @param description Adım açıklaması
 * @param player      Adımı gerçekleştiren taraf
 */
public record Flow(String id, String description, Player player) implements EntryPoint {

    public Flow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(player, "player");
        description = description == null ? "" : description;
    }

    @Override
    public EntryPointKind entryPointKind() {
        return EntryPointKind.FLOW;
    }
}
