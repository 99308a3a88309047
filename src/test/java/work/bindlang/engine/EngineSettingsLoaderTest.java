package work.bindlang.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class EngineSettingsLoaderTest {
    @Test
    void loadsFixtureFile() {
        var settings = EngineSettingsLoader.load(Path.of("src", "test", "resources", "config", "bindlang.toml"));
        assertEquals(3, settings.maxRounds());
        assertEquals(4, settings.maxTurns());
        assertFalse(settings.applyMutations());
        assertEquals("effects", settings.mutationKey());
        assertEquals("priority", settings.weightKey());
    }

    @Test
    void missingKeysKeepDefaults() {
        var settings = EngineSettingsLoader.parse("[cascade]\nmax_rounds = 2\n");
        assertEquals(2, settings.maxRounds());
        assertEquals(EngineSettings.DEFAULT_MAX_TURNS, settings.maxTurns());
        assertTrue(settings.applyMutations());
        assertEquals(EngineSettings.DEFAULT_MUTATION_KEY, settings.mutationKey());
        assertEquals(EngineSettings.defaults(), EngineSettingsLoader.parse(""));
    }

    @Test
    void rejectsInvalidToml() {
        var ex = assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[cascade\nmax_rounds = "));
        assertTrue(ex.getMessage().startsWith("Invalid engine settings"));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[cascade]\nmax_turns = 0\n"));
        assertThrows(IllegalArgumentException.class, () -> EngineSettingsLoader.parse("[cascade]\nmax_rounds = -1\n"));
    }
}
