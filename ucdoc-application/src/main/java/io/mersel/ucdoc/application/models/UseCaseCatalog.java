package io.mersel.ucdoc.application.models;

import io.mersel.ucdoc.application.interfaces.StructuralReferenceException;

import java.util.List;
import java.util.Optional;

/**
 * Tanım dosyalarından kurulan modelin tamamı.
 */
public record UseCaseCatalog(List<Actor> actors, GlossaryCatalog glossaries, List<Factor> factors,
                             List<UseCase> useCases, List<BusinessScenario> scenarios) {

    public UseCaseCatalog {
        actors = List.copyOf(actors);
        glossaries = glossaries == null ? GlossaryCatalog.empty() : glossaries;
        factors = List.copyOf(factors);
        useCases = List.copyOf(useCases);
        scenarios = List.copyOf(scenarios);
        if (actors.isEmpty()) {
            throw new StructuralReferenceException("actors", "en az bir aktör tanımlanmalı");
        }
        if (useCases.isEmpty()) {
            throw new StructuralReferenceException("usecases", "en az bir kullanım senaryosu tanımlanmalı");
        }
    }

    public Optional<UseCase> findUseCase(String useCaseId) {
        return useCases.stream().filter(u -> u.id().equals(useCaseId)).findFirst();
    }

    public Optional<Actor> findActor(String actorId) {
        return actors.stream().filter(a -> a.id().equals(actorId)).findFirst();
    }

    public Optional<Factor> findFactor(String factorId) {
        return factors.stream().filter(f -> f.id().equals(factorId)).findFirst();
    }
}
