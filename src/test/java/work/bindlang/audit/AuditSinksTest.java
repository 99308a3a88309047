package work.bindlang.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.bindlang.support.EngineTestSupport.NOW;
import static work.bindlang.support.EngineTestSupport.context;
import static work.bindlang.support.EngineTestSupport.engine;
import static work.bindlang.support.EngineTestSupport.unit;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.bindlang.model.Attempt;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Guard;

class AuditSinksTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private static Attempt success(String id) {
        return Attempt.success(id, NOW, context("alice"));
    }

    @Test
    void jsonlSinkFlushesWhenBufferFills() throws Exception {
        var file = tempDir.resolve("nested").resolve("audit.jsonl");
        var sink = new JsonlFileSink(file, 2, false);

        sink.write(success("a"));
        assertEquals(0, Files.readAllLines(file).size());
        sink.write(success("b"));
        assertEquals(2, Files.readAllLines(file).size());

        sink.write(success("c"));
        sink.close();
        var lines = Files.readAllLines(file);
        assertEquals(3, lines.size());
        assertEquals("c", JSON.readTree(lines.get(2)).get("unitId").asText());
        assertThrows(IllegalStateException.class, () -> sink.write(success("d")));
    }

    @Test
    void jsonlSinkAppendsByDefault() throws Exception {
        var file = tempDir.resolve("audit.jsonl");
        try (var first = new JsonlFileSink(file)) {
            first.write(success("a"));
        }
        try (var second = new JsonlFileSink(file)) {
            second.write(success("b"));
        }
        assertEquals(2, Files.readAllLines(file).size());
    }

    @Test
    void jsonSinkWritesArrayOnClose() throws Exception {
        var file = tempDir.resolve("audit.json");
        var sink = new JsonFileSink(file);
        sink.write(success("a"));
        sink.write(Attempt.failure("b", NOW, context("bob"),
            List.of(new FailureReason(ConditionKind.ACTOR, List.of("alice"), "bob", "actor: 'bob' not in [alice]"))));
        assertFalse(Files.exists(file));

        sink.close();

        var root = JSON.readTree(file.toFile());
        assertEquals(2, root.size());
        assertEquals("actor", root.get(1).get("failureReasons").get(0).get("condition").asText());
        assertEquals("bob", root.get(1).get("context").get("actor").asText());
    }

    @Test
    void emptyJsonSinkWritesNothing() {
        var file = tempDir.resolve("empty.json");
        new JsonFileSink(file).close();
        assertFalse(Files.exists(file));
    }

    @Test
    void multiplexFansOutAndCollectsCloseFailures() {
        var first = new InMemoryAuditSink();
        var second = new InMemoryAuditSink();
        var failing = new AuditSink() {
            @Override
            public void write(Attempt attempt) {}

            @Override
            public void flush() {}

            @Override
            public void close() {
                throw new IllegalStateException("boom");
            }
        };
        var sink = new MultiplexAuditSink(first, failing, second);

        sink.write(success("a"));
        sink.flush();
        var ex = assertThrows(IllegalStateException.class, sink::close);

        assertEquals("boom", ex.getMessage());
        assertEquals(1, first.attempts().size());
        assertEquals(1, second.attempts().size());
        assertEquals(1, first.flushCount());
        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
    }

    @Test
    void engineStreamsAttemptsToSink() throws Exception {
        var file = tempDir.resolve("engine.jsonl");
        var engine = engine(new JsonlFileSink(file, 100, false));
        engine.bind(unit("ok"), context("alice"));
        engine.bind(unit("no", Guard.builder().actors("bob").build()), context("alice"));
        engine.flush();

        var lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        Map<?, ?> failure = JSON.readValue(lines.get(1), Map.class);
        assertEquals(false, failure.get("success"));
        engine.close();
    }

    @Test
    void nullSinkIgnoresEverything() {
        var sink = NullAuditSink.INSTANCE;
        sink.write(success("a"));
        sink.flush();
        sink.close();
        assertSame(NullAuditSink.INSTANCE, sink);
    }
}
