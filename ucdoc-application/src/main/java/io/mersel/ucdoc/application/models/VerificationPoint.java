package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.VerificationPointKind;

/**
 * Bir varyasyon sonucunun doğruladığı hedef.
 */
public sealed interface VerificationPoint permits PostCondition, AltExFlow {

    String id();

    String description();

    VerificationPointKind verificationPointKind();
}
