package io.mersel.ucdoc.application.enums;

/**
 * Temel akıştan ayrılan dal türü.
 */
public enum BranchKind {
    ALTERNATE,
    EXCEPTION
}
