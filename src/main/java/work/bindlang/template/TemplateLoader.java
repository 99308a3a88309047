package work.bindlang.template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.bindlang.model.Guard;

/**
 * Loads {@link UnitTemplate} definitions from TOML:
 * <pre>
 * [[templates]]
 * pattern = "ACTION:*"
 * required = ["action"]
 * optional = ["state_mutation"]
 *
 * [templates.default_guard]
 * actors = ["player"]
 *
 * [templates.guard_requirements]
 * actors = "required"
 * </pre>
 */
public final class TemplateLoader {
    private TemplateLoader() {}

    public static List<UnitTemplate> load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read templates: " + path, ex);
        }
    }

    public static List<UnitTemplate> parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(TomlParseError::toString).collect(Collectors.joining("; "));
            throw new TemplateViolationException("Invalid template file: " + messages);
        }
        TomlArray entries = result.getArrayOrEmpty("templates");
        List<UnitTemplate> templates = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            templates.add(fromTable(entries.getTable(i)));
        }
        return templates;
    }

    private static UnitTemplate fromTable(TomlTable table) {
        var builder = UnitTemplate.builder(table.getString("pattern"))
            .required(strings(table.getArrayOrEmpty("required")))
            .optional(strings(table.getArrayOrEmpty("optional")));
        var requirements = table.getTable("guard_requirements");
        if (requirements != null) {
            for (String key : requirements.keySet()) {
                builder.guardRequirement(key, toPlain(requirements.get(key)));
            }
        }
        var guard = table.getTable("default_guard");
        if (guard != null) {
            builder.defaultGuard(guardFrom(guard));
        }
        return builder.build();
    }

    private static Guard guardFrom(TomlTable table) {
        var builder = Guard.builder();
        if (table.isArray("actors")) {
            builder.actors(strings(table.getArrayOrEmpty("actors")));
        }
        if (table.isString("temporal")) {
            builder.temporal(table.getString("temporal"));
        }
        if (table.isArray("locations")) {
            builder.locations(strings(table.getArrayOrEmpty("locations")));
        }
        var state = table.getTable("state");
        if (state != null) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String key : state.keySet()) {
                values.put(key, toPlain(state.get(key)));
            }
            builder.state(values);
        }
        return builder.build();
    }

    private static List<String> strings(TomlArray array) {
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(String.valueOf(array.get(i)));
        }
        return values;
    }

    private static Object toPlain(Object value) {
        if (value instanceof TomlTable table) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : table.keySet()) {
                map.put(key, toPlain(table.get(key)));
            }
            return map;
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(toPlain(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
