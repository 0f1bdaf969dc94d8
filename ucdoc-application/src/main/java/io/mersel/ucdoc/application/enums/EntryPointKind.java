package io.mersel.ucdoc.application.enums;

/**
 * Faktörlerin bağlanabildiği giriş noktası türleri.
 */
public enum EntryPointKind {
    PRE_CONDITION,
    FLOW
}
