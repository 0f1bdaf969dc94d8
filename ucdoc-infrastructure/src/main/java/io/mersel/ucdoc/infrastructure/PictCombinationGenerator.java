package io.mersel.ucdoc.infrastructure;

import io.mersel.ucdoc.application.interfaces.AdapterProtocolException;
import io.mersel.ucdoc.application.interfaces.ICombinationGenerator;
import io.mersel.ucdoc.application.models.Factor;
import io.mersel.ucdoc.application.models.FactorEntryPoint;
import io.mersel.ucdoc.application.models.FactorLevel;
import io.mersel.ucdoc.application.models.PictCombination;
import io.mersel.ucdoc.infrastructure.config.UcdocProperties;
import io.mersel.ucdoc.infrastructure.diagnostics.UcdocMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Harici {@code pict} aracını bloklayan alt süreç olarak çalıştıran kombinasyon üreticisi.
 * <p>
 * İstek dosyası çalışma dizinine yazılır, komut yapılandırılan zaman aşımıyla
 * çalıştırılır, standart çıktı {@link PictProtocol} ile çözümlenir. Hata yeniden denenmez.
 */
@Service
public class PictCombinationGenerator implements ICombinationGenerator {

    private static final Logger log = LoggerFactory.getLogger(PictCombinationGenerator.class);

    private final UcdocProperties properties;
    private final UcdocMetrics metrics;

    public PictCombinationGenerator(UcdocProperties properties, UcdocMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public PictCombination generate(FactorEntryPoint binding, String constraint) {
        List<Factor> factors = binding.getFactors();
        if (factors.isEmpty()) {
            return new PictCombination(binding, constraint, Map.of());
        }

        List<List<FactorLevel>> effective = new ArrayList<>();
        List<Integer> levelCounts = new ArrayList<>();
        for (Factor factor : factors) {
            List<FactorLevel> levels = binding.getEffectiveLevels(factor.id());
            effective.add(levels);
            levelCounts.add(levels.size());
        }

        long startTime = System.currentTimeMillis();
        boolean success = false;
        try {
            String output = run(PictProtocol.encodeRequest(levelCounts, constraint));
            List<int[]> rows = PictProtocol.decodeResponse(output, levelCounts);

            Map<String, List<FactorLevel>> levelsByFactorId = new LinkedHashMap<>();
            for (int f = 0; f < factors.size(); f++) {
                List<FactorLevel> column = new ArrayList<>(rows.size());
                for (int[] row : rows) {
                    column.add(effective.get(f).get(row[f]));
                }
                levelsByFactorId.put(factors.get(f).id(), column);
            }
            success = true;
            log.debug("  PICT: {} faktör, {} kural üretildi", factors.size(), rows.size());
            return new PictCombination(binding, constraint, levelsByFactorId);
        } finally {
            metrics.recordGeneratorRun(success, System.currentTimeMillis() - startTime);
        }
    }

    private String run(String request) {
        Path workDir = resolveWorkDir();
        Path requestFile = null;
        Path outFile = null;
        Path errFile = null;
        try {
            Files.createDirectories(workDir);
            requestFile = Files.createTempFile(workDir, "ucdoc-", ".pict");
            outFile = Files.createTempFile(workDir, "ucdoc-", ".out");
            errFile = Files.createTempFile(workDir, "ucdoc-", ".err");
            Files.writeString(requestFile, request, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>(properties.getPict().getCommandLine());
            command.add(requestFile.toAbsolutePath().toString());

            Process process = new ProcessBuilder(command)
                    .redirectOutput(outFile.toFile())
                    .redirectError(errFile.toFile())
                    .start();

            boolean finished = process.waitFor(properties.getPict().getTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new AdapterProtocolException("PICT zaman aşımına uğradı ("
                        + properties.getPict().getTimeoutMs() + " ms)");
            }
            if (process.exitValue() != 0) {
                String stderr = Files.readString(errFile, StandardCharsets.UTF_8).trim();
                throw new AdapterProtocolException("PICT hata koduyla sonlandı: " + process.exitValue()
                        + (stderr.isEmpty() ? "" : " - " + stderr));
            }
            return Files.readString(outFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AdapterProtocolException("PICT çalıştırılamadı: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterProtocolException("PICT beklenirken kesildi", e);
        } finally {
            deleteQuietly(requestFile);
            deleteQuietly(outFile);
            deleteQuietly(errFile);
        }
    }

    private Path resolveWorkDir() {
        String configured = properties.getPict().getWorkDir();
        if (configured == null || configured.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"));
        }
        return Path.of(configured);
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Geçici PICT dosyası silinemedi: {} - {}", file, e.getMessage());
        }
    }
}
