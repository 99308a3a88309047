package work.bindlang.engine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;

/**
 * Reads {@link EngineSettings} from a TOML file:
 * <pre>
 * [cascade]
 * max_rounds = 10
 * max_turns = 10
 * apply_mutations = true
 *
 * [payload]
 * mutation_key = "state_mutation"
 * weight_key = "weight"
 * </pre>
 * Missing keys keep their defaults.
 */
public final class EngineSettingsLoader {
    private EngineSettingsLoader() {}

    public static EngineSettings load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read engine settings: " + path, ex);
        }
    }

    public static EngineSettings parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(TomlParseError::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid engine settings: " + messages);
        }
        return fromToml(result);
    }

    public static EngineSettings fromToml(TomlParseResult result) {
        var builder = EngineSettings.builder();
        Long maxRounds = result.getLong("cascade.max_rounds");
        if (maxRounds != null) {
            builder.maxRounds(Math.toIntExact(maxRounds));
        }
        Long maxTurns = result.getLong("cascade.max_turns");
        if (maxTurns != null) {
            builder.maxTurns(Math.toIntExact(maxTurns));
        }
        Boolean applyMutations = result.getBoolean("cascade.apply_mutations");
        if (applyMutations != null) {
            builder.applyMutations(applyMutations);
        }
        String mutationKey = result.getString("payload.mutation_key");
        if (mutationKey != null && !mutationKey.isBlank()) {
            builder.mutationKey(mutationKey);
        }
        String weightKey = result.getString("payload.weight_key");
        if (weightKey != null && !weightKey.isBlank()) {
            builder.weightKey(weightKey);
        }
        return builder.build();
    }
}
