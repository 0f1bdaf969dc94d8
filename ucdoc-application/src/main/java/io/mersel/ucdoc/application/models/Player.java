package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.PlayerKind;

/**
 * Bir akış adımını gerçekleştiren taraf: aktör veya sözlük terimi.
 */
public sealed interface Player permits Actor, Glossary {

    String id();

    /**
     * @return Dokümanda gösterilecek metin
     */
    String text();

    PlayerKind kind();
}
