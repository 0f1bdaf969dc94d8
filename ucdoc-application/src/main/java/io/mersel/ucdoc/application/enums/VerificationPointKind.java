package io.mersel.ucdoc.application.enums;

/**
 * Bir varyasyon sonucunun doğrulayabildiği hedef türleri.
 */
public enum VerificationPointKind {
    POST_CONDITION,
    ALTERNATE_FLOW,
    EXCEPTION_FLOW
}
