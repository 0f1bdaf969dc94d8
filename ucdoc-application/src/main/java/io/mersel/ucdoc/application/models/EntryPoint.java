package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.enums.EntryPointKind;

/**
 * Faktörlerin bağlandığı nokta: ön koşul veya akış adımı.
 */
public sealed interface EntryPoint permits PreCondition, Flow {

    String id();

    String description();

    EntryPointKind entryPointKind();
}
