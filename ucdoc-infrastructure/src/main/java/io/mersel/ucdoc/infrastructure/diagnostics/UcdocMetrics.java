package io.mersel.ucdoc.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.mersel.ucdoc.application.enums.CoverageGapType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * UCDoc özel metrikleri.
 */
@Component
public class UcdocMetrics {

    private final MeterRegistry registry;

    public UcdocMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Kombinasyon üreticisi çalıştırma metrikleri kaydet.
     *
     * @param success    Çıktı başarıyla çözümlendi mi
     * @param durationMs Süreç süresi (milisaniye)
     */
    public void recordGeneratorRun(boolean success, long durationMs) {
        Counter.builder("ucdoc_pict_runs_total")
                .tag("status", success ? "success" : "failure")
                .description("PICT çalıştırma sayısı")
                .register(registry)
                .increment();

        Timer.builder("ucdoc_pict_run_duration_seconds")
                .description("PICT çalıştırma süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Üretilen karar tablosu sayısını kaydet.
     *
     * @param ruleCount Tablonun kural sayısı
     */
    public void recordDecisionTable(int ruleCount) {
        Counter.builder("ucdoc_decision_tables_total")
                .description("Üretilen karar tablosu sayısı")
                .register(registry)
                .increment();

        registry.summary("ucdoc_decision_table_rules").record(ruleCount);
    }

    /**
     * Kapsam boşluklarını türüne göre kaydet.
     */
    public void recordCoverageGap(CoverageGapType type) {
        Counter.builder("ucdoc_coverage_gaps_total")
                .tag("type", type.name())
                .description("Tespit edilen kapsam boşluğu sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Yükleme metrikleri kaydet.
     *
     * @param useCaseCount Kurulan kullanım senaryosu sayısı
     * @param durationMs   Yükleme süresi (milisaniye)
     */
    public void recordLoad(int useCaseCount, long durationMs) {
        Counter.builder("ucdoc_usecases_loaded_total")
                .description("Yüklenen kullanım senaryosu sayısı")
                .register(registry)
                .increment(useCaseCount);

        Timer.builder("ucdoc_load_duration_seconds")
                .description("Tanım yükleme süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Adım id önbelleği boyutu için gauge kaydeder.
     *
     * @param cache Adım id önbelleği (Caffeine)
     */
    public void registerStepIdCacheSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("ucdoc_step_id_cache_size", cache, c -> (double) c.estimatedSize())
                .description("Önbelleğe alınmış adım id sayısı")
                .register(registry);
    }
}
