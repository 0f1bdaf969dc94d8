package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.application.interfaces.SpecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tanım dosyalarını SnakeYAML ile okur ve sırayla derin birleştirir.
 * <p>
 * Birleştirme kuralları: haritalar özyinelemeli birleşir, listeler uç uca eklenir,
 * skaler değerlerde sonraki dosya kazanır.
 */
@Component
public class SpecYamlReader {

    private static final Logger log = LoggerFactory.getLogger(SpecYamlReader.class);

    public Map<String, Object> read(List<Path> files) throws IOException {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("En az bir tanım dosyası verilmeli");
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Path file : files) {
            Map<String, Object> document = readFile(file);
            merge(merged, document);
            log.info("  → {} okundu ({} üst düzey anahtar)", file.getFileName(), document.size());
        }
        return merged;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readFile(Path file) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream is = Files.newInputStream(file)) {
            Object data = yaml.load(is);
            if (data == null) {
                return new LinkedHashMap<>();
            }
            if (!(data instanceof Map)) {
                throw new SpecException(file.getFileName().toString(), "YAML kökü bir harita olmalı");
            }
            return (Map<String, Object>) data;
        } catch (YAMLException e) {
            throw new SpecException(file.getFileName().toString(), "YAML ayrıştırılamadı: " + e.getMessage(), e);
        }
    }

    /**
     * {@code source} içeriğini {@code target} üzerine derin birleştirir.
     */
    @SuppressWarnings("unchecked")
    static void merge(Map<String, Object> target, Map<String, Object> source) {
        for (var entry : source.entrySet()) {
            Object existing = target.get(entry.getKey());
            Object incoming = entry.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) existing);
                merge(copy, (Map<String, Object>) incoming);
                target.put(entry.getKey(), copy);
            } else if (existing instanceof List && incoming instanceof List) {
                List<Object> combined = new ArrayList<>((List<Object>) existing);
                combined.addAll((List<Object>) incoming);
                target.put(entry.getKey(), combined);
            } else {
                target.put(entry.getKey(), incoming);
            }
        }
    }
}
