package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.enums.ValidationMode;
import io.mersel.ucdoc.application.interfaces.ICoverageValidator;
import io.mersel.ucdoc.application.interfaces.IDecisionTableBuilder;
import io.mersel.ucdoc.application.interfaces.IUseCaseSpecLoader;
import io.mersel.ucdoc.application.models.CoverageReport;
import io.mersel.ucdoc.application.models.CoverageWarning;
import io.mersel.ucdoc.application.models.DecisionTable;
import io.mersel.ucdoc.application.models.SpecLoadResult;
import io.mersel.ucdoc.application.models.UseCase;
import io.mersel.ucdoc.application.models.UseCaseCatalog;
import io.mersel.ucdoc.application.models.Variation;
import io.mersel.ucdoc.infrastructure.config.UcdocProperties;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import io.mersel.ucdoc.infrastructure.yaml.SpecAssembly;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.AppProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecPropsReader;
import io.mersel.ucdoc.infrastructure.yaml.SpecYamlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tanım yükleyici.
 * <p>
 * Akış: YAML okuma ve birleştirme → tipli ağaç → aktör/sözlük/faktör tanımları →
 * anahtar kelime çözümleme → kullanım senaryosu kurulumu (kombinasyon üretimi dahil) →
 * karar tabloları → kapsam doğrulaması → iş senaryoları. Herhangi bir adımdaki hata
 * yüklemeyi durdurur; yarım kurulmuş model döndürülmez.
 */
@Service
public class UseCaseSpecLoader implements IUseCaseSpecLoader {

    private static final Logger log = LoggerFactory.getLogger(UseCaseSpecLoader.class);

    private final SpecYamlReader yamlReader;
    private final SpecPropsReader propsReader;
    private final SpecAssembly assembly;
    private final IDecisionTableBuilder tableBuilder;
    private final ICoverageValidator coverageValidator;
    private final UcdocProperties properties;
    private final UcdocMetrics metrics;

    public UseCaseSpecLoader(SpecYamlReader yamlReader, SpecPropsReader propsReader, SpecAssembly assembly,
                             IDecisionTableBuilder tableBuilder, ICoverageValidator coverageValidator,
                             UcdocProperties properties, UcdocMetrics metrics) {
        this.yamlReader = yamlReader;
        this.propsReader = propsReader;
        this.assembly = assembly;
        this.tableBuilder = tableBuilder;
        this.coverageValidator = coverageValidator;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public SpecLoadResult load(List<Path> files, ValidationMode mode) throws IOException {
        long startTime = System.currentTimeMillis();
        log.info("Tanım dosyaları yükleniyor: {} dosya, kip: {}", files.size(), mode);

        AppProps props = propsReader.read(yamlReader.read(files));
        UseCaseCatalog catalog = assembly.assemble(props, properties.getKeyword().getReplacementFormat());

        Map<String, Map<String, DecisionTable>> tables = new LinkedHashMap<>();
        List<CoverageWarning> warnings = new ArrayList<>();
        for (UseCase useCase : catalog.useCases()) {
            Map<String, DecisionTable> byVariation = new LinkedHashMap<>();
            for (Variation variation : useCase.variations()) {
                byVariation.put(variation.id(), tableBuilder.build(variation));
            }
            CoverageReport report = coverageValidator.validate(useCase, byVariation, mode);
            warnings.addAll(report.warnings());
            tables.put(useCase.id(), byVariation);
            log.info("  → {} ({}): {} varyasyon, {} uyarı",
                    useCase.id(), useCase.name(), byVariation.size(), report.warnings().size());
        }

        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordLoad(catalog.useCases().size(), elapsed);
        log.info("Tanım yüklendi: {} kullanım senaryosu, {} iş senaryosu, {} uyarı ({} ms)",
                catalog.useCases().size(), catalog.scenarios().size(), warnings.size(), elapsed);
        return new SpecLoadResult(catalog, tables, warnings);
    }
}
