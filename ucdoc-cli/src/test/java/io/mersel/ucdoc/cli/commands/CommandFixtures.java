package io.mersel.ucdoc.cli.commands;

import io.mersel.ucdoc.application.models.Actor;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.ExceptionFlow;
import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.FactorEntryPoint;
import io.mersel.ucdoc.application.models.FactorLevel;
import io.mersel.ucdoc.application.models.FactorLevelChoice;
import io.mersel.ucdoc.application.models.Flow;
import io.mersel.ucdoc.application.models.FlowLinks;
import io.mersel.ucdoc.application.models.GlossaryCatalog;
import io.mersel.ucdoc.application.models.PictCombination;
import io.mersel.ucdoc.application.models.PostCondition;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.UseCaseCatalog;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.application.models.VariationResult;
import io.mersel.ucdoc.infrastructure.DecisionTableBuilder;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Map;

/**
 * Tek varyasyonlu ödeme örneği: B01 üzerinde {@code amount = 0|100}, 0 tutarda E01 istisnası.
 */
final class CommandFixtures {

    private CommandFixtures() {
    }

    static SpecLoadResult payment() {
        Actor customer = new Actor("U01", "Müşteri");
        Flow b01 = new Flow("B01", "Müşteri tutarı girer", customer);
        Flow b02 = new Flow("B02", "Sistem ödemeyi alır", customer);
        Flow e0101 = new Flow("E0101", "Sistem tutarı reddeder", customer);
        ExceptionFlow e01 = new ExceptionFlow("E01", "Sıfır tutar", List.of(b01), List.of(e0101));
        PostCondition p01 = new PostCondition("P01", "Ödeme alınır", List.of());
        Factor amount = Factor.of("amount", "0", "100");

        FactorEntryPoint binding = new FactorEntryPoint();
        binding.add(b01, List.of(amount));
        PictCombination combination = new PictCombination(binding, "",
                Map.of("amount", List.of(new FactorLevel("0"), new FactorLevel("100"))));
        Variation variation = new Variation("V01", "Tutar", binding, combination, List.of(
                new VariationResult("VR01", "Ödeme alınır", List.of(FactorLevelChoice.of("amount", "100")), List.of(p01)),
                new VariationResult("VR02", "Reddedilir", List.of(FactorLevelChoice.of("amount", "0")), List.of(e01))));

        UseCase useCase = new UseCase("UC01", "Ödeme", "", List.of(), List.of(p01), List.of(b01, b02), List.of(),
                List.of(e01), List.of(variation), FlowLinks.link(List.of(e01)), List.of());
        DecisionTable table = new DecisionTableBuilder(new UcdocMetrics(new SimpleMeterRegistry())).build(variation);

        UseCaseCatalog catalog = new UseCaseCatalog(List.of(customer), GlossaryCatalog.empty(), List.of(amount),
                List.of(useCase), List.of());
        return new SpecLoadResult(catalog, Map.of("UC01", Map.of("V01", table)), List.of());
    }
}
