package io.mersel.ucdoc.application.enums;

/**
 * Akış adımını gerçekleştiren tarafın türü.
 */
public enum PlayerKind {
    ACTOR,
    GLOSSARY
}
