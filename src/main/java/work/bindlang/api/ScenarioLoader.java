package work.bindlang.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.bindlang.model.ConsumptionMode;
import work.bindlang.model.Context;
import work.bindlang.model.Guard;
import work.bindlang.model.Unit;
import work.bindlang.orchestration.ActorTurn;
import work.bindlang.shared.IsoTimestamps;

/**
 * Reads scenario documents. YAML is parsed with Jackson's YAML factory, which also accepts JSON.
 * <pre>
 * name: key-door
 * context:
 *   actor: alice
 *   timestamp: "2025-06-01T10:00:00"
 *   location: hall
 *   state: { hasKey: false }
 * units:
 *   - id: pick_key
 *     type: ACTION:pick_up
 *     guard: { actors: [alice], state: { hasKey: false } }
 *     payload: { state_mutation: { hasKey: true } }
 * </pre>
 */
public final class ScenarioLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ScenarioLoader() {}

    public static Scenario load(Path path) {
        try {
            return parse(Files.readString(path), Clock.systemDefaultZone());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read scenario: " + path, ex);
        }
    }

    public static Scenario parse(String content) {
        return parse(content, Clock.systemDefaultZone());
    }

    /**
     * @param clock supplies the context timestamp when the document leaves it out
     */
    public static Scenario parse(String content, Clock clock) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid scenario document: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Scenario document must be an object");
        }
        var document = asMap(convertNode(root), "scenario");
        var context = toContext(asMap(document.get("context"), "context"), clock);
        var units = new ArrayList<Unit>();
        int index = 0;
        for (Object entry : asList(document.get("units"), "units")) {
            units.add(toUnit(asMap(entry, "units[" + index + "]"), index));
            index++;
        }
        var turns = new ArrayList<ActorTurn>();
        index = 0;
        for (Object entry : asList(document.get("turns"), "turns")) {
            turns.add(toTurn(asMap(entry, "turns[" + index + "]")));
            index++;
        }
        return new Scenario(
            stringOrNull(document.get("name")),
            units,
            context,
            turns,
            Boolean.TRUE.equals(document.get("evolve"))
        );
    }

    private static Context toContext(Map<String, Object> raw, Clock clock) {
        var timestamp = stringOrNull(raw.get("timestamp"));
        return new Context(
            stringOrNull(raw.get("actor")),
            timestamp == null ? LocalDateTime.now(clock) : IsoTimestamps.parse(timestamp),
            stringOrNull(raw.get("location")),
            asMap(raw.get("state"), "context.state")
        );
    }

    private static Unit toUnit(Map<String, Object> raw, int index) {
        var id = stringOrNull(raw.get("id"));
        var type = stringOrNull(raw.get("type"));
        if (id == null || type == null) {
            throw new IllegalArgumentException("Scenario unit #" + index + " needs both 'id' and 'type'");
        }
        var dependsOn = new ArrayList<String>();
        for (Object dependency : asList(raw.get("depends_on"), id + ".depends_on")) {
            dependsOn.add(String.valueOf(dependency));
        }
        return Unit.builder(id, type)
            .guard(toGuard(asMap(raw.get("guard"), id + ".guard"), id))
            .payload(asMap(raw.get("payload"), id + ".payload"))
            .metadata(asMap(raw.get("metadata"), id + ".metadata"))
            .dependsOn(dependsOn)
            .consumption(ConsumptionMode.from(stringOrNull(raw.get("consumption"))))
            .build();
    }

    private static Guard toGuard(Map<String, Object> raw, String unitId) {
        if (raw.isEmpty()) {
            return Guard.open();
        }
        var builder = Guard.builder().temporal(stringOrNull(raw.get("temporal")));
        if (raw.containsKey("actors")) {
            builder.actors(strings(raw.get("actors"), unitId + ".guard.actors"));
        }
        if (raw.containsKey("locations")) {
            builder.locations(strings(raw.get("locations"), unitId + ".guard.locations"));
        }
        if (raw.containsKey("state")) {
            builder.state(asMap(raw.get("state"), unitId + ".guard.state"));
        }
        return builder.build();
    }

    private static ActorTurn toTurn(Map<String, Object> raw) {
        var timestamp = stringOrNull(raw.get("timestamp"));
        return new ActorTurn(
            stringOrNull(raw.get("actor")),
            stringOrNull(raw.get("location")),
            timestamp == null ? null : IsoTimestamps.parse(timestamp)
        );
    }

    private static List<String> strings(Object value, String field) {
        var values = new ArrayList<String>();
        for (Object item : asList(value, field)) {
            values.add(String.valueOf(item));
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String field) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("Scenario field '" + field + "' must be an object");
    }

    private static List<?> asList(Object value, String field) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Scenario field '" + field + "' must be a list");
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
