package io.mersel.ucdoc.application.models;

import java.util.List;
import java.util.Objects;

/**
 * İş senaryosu: kullanım senaryolarının çalıştırılma sırası.
 */
public record BusinessScenario(String id, String name, String summary, List<UseCase> useCaseOrder) {

    public BusinessScenario {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
        summary = summary == null ? "" : summary;
        useCaseOrder = List.copyOf(useCaseOrder);
    }
}
