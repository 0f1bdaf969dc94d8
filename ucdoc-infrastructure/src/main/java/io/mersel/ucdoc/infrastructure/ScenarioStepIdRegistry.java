package io.mersel.ucdoc.infrastructure;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Kararlı adım id'leri.
 * <p>
 * (giriş noktası, faktör, seviye) üçlüsü başına bir id süreç boyunca saklanır.
 * Bir giriş noktasının ilk üçlüsü giriş noktası id'sini alır, sonrakiler
 * {@code <giriş noktası>-<n>} ({@code n >= 2}) olur. Aynı üçlü her zaman aynı id'yi alır.
 * <p>
 * Üretilen id hiçbir zaman iki kez verilmez ve kullanım senaryosunda tanımlı başka bir
 * id ile çakışmaz; dolu bir sıra eki atlanır ({@code B01-2} tanımlıysa {@code B01-3} verilir).
 */
@Component
public class ScenarioStepIdRegistry {

    private final Cache<String, String> stepIds = Caffeine.newBuilder().build();
    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();
    private final Set<String> issued = ConcurrentHashMap.newKeySet();

    public ScenarioStepIdRegistry(UcdocMetrics metrics) {
        metrics.registerStepIdCacheSizeGauge(stepIds);
    }

    /**
     * @param declaredIds Kullanım senaryosunda tanımlı ön koşul ve akış id'leri
     */
    public String stepId(String entryPointId, String factorId, String level, Set<String> declaredIds) {
        String key = entryPointId + "\n" + factorId + "\n" + level;
        return stepIds.get(key, k -> next(entryPointId, declaredIds));
    }

    private String next(String entryPointId, Set<String> declaredIds) {
        AtomicInteger counter = counters.computeIfAbsent(entryPointId, k -> new AtomicInteger());
        while (true) {
            int sequence = counter.incrementAndGet();
            String candidate = sequence == 1 ? entryPointId : entryPointId + "-" + sequence;
            boolean declaredElsewhere = !candidate.equals(entryPointId) && declaredIds.contains(candidate);
            if (!declaredElsewhere && issued.add(candidate)) {
                return candidate;
            }
        }
    }

    long size() {
        return stepIds.estimatedSize();
    }
}
