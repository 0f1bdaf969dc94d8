package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.PlayerKind;

import java.util.Objects;

/**
 * Sistemle etkileşen aktör.
 *
 * @param id   Aktör id'si
 * @param name Görünen ad
 */
public record Actor(String id, String name) implements Player {

    public Actor {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
    }

    @Override
    public String text() {
        return name;
    }

    @Override
    public PlayerKind kind() {
        return PlayerKind.ACTOR;
    }
}
