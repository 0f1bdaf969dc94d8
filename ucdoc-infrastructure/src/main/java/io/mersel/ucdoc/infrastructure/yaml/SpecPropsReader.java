package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ActorProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.AppProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.BranchProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ConditionProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.FactorProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.FlowProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.GlossaryProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.OverrideProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ResultProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.ScenarioProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.UseCaseProps;
import io.mersel.ucdoc.infrastructure.yaml.SpecProps.VariationProps;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Birleştirilmiş YAML haritasını {@link SpecProps} ağacına dönüştürür.
 * <p>
 * Bilinmeyen anahtarlar yok sayılır. Tip uyuşmazlıkları noktalı yol ile raporlanır.
 */
@Component
public class SpecPropsReader {

    public AppProps read(Map<String, Object> root) {
        ParserContext ctx = new ParserContext();
        return new AppProps(
                entries(ctx, root, "actors", this::actor),
                entries(ctx, root, "glossaries", (c, v) -> entries(c, asMap(c, v), null, this::glossary)),
                entries(ctx, root, "factors", this::factor),
                entries(ctx, root, "usecases", this::useCase),
                entries(ctx, root, "scenarios", this::scenario));
    }

    private ActorProps actor(ParserContext ctx, Object value) {
        Map<String, Object> map = asMapOrEmpty(ctx, value);
        return new ActorProps(string(ctx, map, "name"));
    }

    private GlossaryProps glossary(ParserContext ctx, Object value) {
        Map<String, Object> map = asMapOrEmpty(ctx, value);
        return new GlossaryProps(string(ctx, map, "name"), string(ctx, map, "desc"), string(ctx, map, "url"));
    }

    private FactorProps factor(ParserContext ctx, Object value) {
        Map<String, Object> map = asMapOrEmpty(ctx, value);
        List<String> items = strings(ctx, map, "items");
        if (items.isEmpty()) {
            throw ctx.push("items").structural("faktör en az bir seviye içermeli");
        }
        return new FactorProps(string(ctx, map, "name"), items);
    }

    private UseCaseProps useCase(ParserContext ctx, Object value) {
        Map<String, Object> map = asMapOrEmpty(ctx, value);
        return new UseCaseProps(
                string(ctx, map, "name"),
                string(ctx, map, "summary"),
                entries(ctx, map, "preConditions", this::condition),
                entries(ctx, map, "postConditions", this::condition),
                entries(ctx, map, "basicFlows", this::flow),
                entries(ctx, map, "alternateFlows", this::branch),
                entries(ctx, map, "exceptionFlows", this::branch),
                entries(ctx, map, "valiations", this::variation));
    }

    /**
     * {@code id: metin} veya {@code id: {description, details}} biçimlerini kabul eder.
     */
    private ConditionProps condition(ParserContext ctx, Object value) {
        if (!(value instanceof Map)) {
            return new ConditionProps(value == null ? null : String.valueOf(value), Map.of());
        }
        Map<String, Object> map = asMap(ctx, value);
        return new ConditionProps(string(ctx, map, "description"), entries(ctx, map, "details", this::condition));
    }

    private FlowProps flow(ParserContext ctx, Object value) {
        Map<String, Object> map = asMap(ctx, value);
        String playerId = string(ctx, map, "playerId");
        if (playerId == null || playerId.isBlank()) {
            throw ctx.push("playerId").structural("playerId tanımı zorunlu");
        }
        return new FlowProps(playerId, string(ctx, map, "description"));
    }

    private BranchProps branch(ParserContext ctx, Object value) {
        Map<String, Object> map = asMap(ctx, value);
        Map<String, OverrideProps> override = entries(ctx, map, "override", this::override);
        if (override.isEmpty()) {
            throw ctx.push("override").structural("en az bir kaynak akış tanımlanmalı");
        }
        return new BranchProps(string(ctx, map, "description"), override);
    }

    private OverrideProps override(ParserContext ctx, Object value) {
        Map<String, Object> map = asMapOrEmpty(ctx, value);
        return new OverrideProps(entries(ctx, map, "replaceFlows", this::flow), string(ctx, map, "returnFlowId"));
    }

    private VariationProps variation(ParserContext ctx, Object value) {
        Map<String, Object> map = asMap(ctx, value);
        Map<String, List<String>> entryPoints = entries(ctx, map, "factorEntryPoints",
                (c, v) -> strings(c, asMapOrEmpty(c, v), "factors"));
        Map<String, ResultProps> results = entries(ctx, map, "results", this::result);
        if (results.isEmpty()) {
            throw ctx.push("results").structural("en az bir sonuç tanımlanmalı");
        }
        return new VariationProps(string(ctx, map, "description"), entryPoints,
                string(ctx, map, "pictConstraint"), results);
    }

    private ResultProps result(ParserContext ctx, Object value) {
        Map<String, Object> map = asMap(ctx, value);
        String key = map.containsKey("verificationPointIds") ? "verificationPointIds" : "checkIds";
        if (!map.containsKey(key)) {
            throw ctx.push("verificationPointIds").structural("verificationPointIds tanımı zorunlu");
        }
        List<String> verificationPointIds = strings(ctx, map, key);
        if (verificationPointIds.isEmpty()) {
            throw ctx.push(key).structural("en az bir doğrulama noktası tanımlanmalı");
        }
        String description = map.containsKey("description") ? string(ctx, map, "description") : string(ctx, map, "desc");
        return new ResultProps(description,
                string(ctx, map, "order"),
                choiceMap(ctx, map, "arrow"),
                choiceMap(ctx, map, "disarrow"),
                verificationPointIds);
    }

    private ScenarioProps scenario(ParserContext ctx, Object value) {
        Map<String, Object> map = asMapOrEmpty(ctx, value);
        return new ScenarioProps(string(ctx, map, "name"), string(ctx, map, "summary"),
                strings(ctx, map, "usecaseOrder"));
    }

    /**
     * arrow/disarrow: {@code {faktör: [seviye, ...]}}. Tanımsızsa null döner.
     */
    private Map<String, List<String>> choiceMap(ParserContext ctx, Map<String, Object> map, String key) {
        if (map.get(key) == null) {
            return null;
        }
        return entries(ctx, map, key, (c, v) -> {
            if (v instanceof List) {
                return toStrings(c, (List<?>) v);
            }
            if (v == null) {
                return List.of();
            }
            return List.of(String.valueOf(v));
        });
    }

    // ── Yardımcılar ──────────────────────────────────────────────

    /**
     * {@code map[key]} altındaki her girdiyi dönüştürür. {@code key} null ise {@code map} doğrudan gezilir.
     */
    private <T> Map<String, T> entries(ParserContext ctx, Map<String, Object> map, String key,
                                       BiFunction<ParserContext, Object, T> converter) {
        Map<String, Object> source;
        if (key == null) {
            source = map;
        } else {
            Object value = map.get(key);
            if (value == null) {
                return new LinkedHashMap<>();
            }
            ctx.push(key);
            source = asMap(ctx, value);
        }
        Map<String, T> result = new LinkedHashMap<>();
        for (var entry : source.entrySet()) {
            ctx.push(entry.getKey());
            result.put(entry.getKey(), converter.apply(ctx, entry.getValue()));
            ctx.pop();
        }
        if (key != null) {
            ctx.pop();
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(ParserContext ctx, Object value) {
        if (!(value instanceof Map)) {
            throw ctx.structural("harita bekleniyordu");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> normalized.put(String.valueOf(k), v));
        return normalized;
    }

    private Map<String, Object> asMapOrEmpty(ParserContext ctx, Object value) {
        return value == null ? Map.of() : asMap(ctx, value);
    }

    private String string(ParserContext ctx, Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw ctx.push(key).structural("metin bekleniyordu");
        }
        return String.valueOf(value);
    }

    private List<String> strings(ParserContext ctx, Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw ctx.push(key).structural("liste bekleniyordu");
        }
        ctx.push(key);
        List<String> result = toStrings(ctx, (List<?>) value);
        ctx.pop();
        return result;
    }

    private List<String> toStrings(ParserContext ctx, List<?> values) {
        List<String> result = new ArrayList<>();
        for (Object item : values) {
            if (item instanceof Map || item instanceof List) {
                throw ctx.structural("metin listesi bekleniyordu");
            }
            result.add(String.valueOf(item));
        }
        return result;
    }
}
