package work.bindlang.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 10, 0);

    @Test
    void withStateReturnsNewContext() {
        var original = new Context("alice", NOW, "hall", Map.of("hasKey", false));
        var updated = original.withState("hasKey", true);

        assertEquals(false, original.stateValue("hasKey"));
        assertEquals(true, updated.stateValue("hasKey"));
        assertEquals("alice", updated.actor());
    }

    @Test
    void stateAllowsNullValues() {
        var ctx = Context.of(null, NOW, null).withState("door", null);
        assertTrue(ctx.state().containsKey("door"));
        assertNull(ctx.stateValue("door"));
        assertEquals("", ctx.location());
    }

    @Test
    void snapshotRendersIsoTimestamp() {
        var snapshot = new Context("bob", NOW, "vault", Map.of("gold", 3)).snapshot();
        assertEquals("bob", snapshot.get("actor"));
        assertEquals("2025-06-01T10:00", snapshot.get("timestamp"));
        assertEquals("vault", snapshot.get("location"));
        assertEquals(Map.of("gold", 3), snapshot.get("state"));
    }
}
