package work.bindlang.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.bindlang.support.EngineTestSupport.NOW;
import static work.bindlang.support.EngineTestSupport.context;
import static work.bindlang.support.EngineTestSupport.engine;
import static work.bindlang.support.EngineTestSupport.fixedClock;
import static work.bindlang.support.EngineTestSupport.unit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.bindlang.audit.InMemoryAuditSink;
import work.bindlang.lifecycle.Transition;
import work.bindlang.lifecycle.UnitState;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Guard;
import work.bindlang.model.Unit;

class BindingEngineTest {
    @Test
    void successfulBindRecordsEverywhere() {
        var sink = new InMemoryAuditSink();
        List<String> activated = new ArrayList<>();
        var engine = BindingEngine.builder()
            .clock(fixedClock())
            .auditSink(sink)
            .onActivated((unit, ctx, bound) -> activated.add(unit.id()))
            .build();
        var greet = Unit.builder("greet", "ACTION:greet")
            .guard(Guard.builder().actors("alice").build())
            .payload("text", "hello")
            .build();
        engine.register(greet);

        var bound = engine.bind(greet, context("alice")).orElseThrow();

        assertEquals("greet", bound.unitId());
        assertEquals("ACTION:greet", bound.type());
        assertEquals("hello", bound.effect().get("text"));
        assertEquals(1.0, bound.weight());
        assertEquals(NOW, bound.boundAt());
        assertTrue(engine.isSatisfied("greet"));
        assertEquals(List.of("greet"), activated);
        assertEquals(1, sink.successes().size());
        assertEquals("greet", engine.audit().latest("greet").orElseThrow().boundResultId());
        assertEquals(
            List.of("created -> dormant", "dormant -> activated"),
            engine.ledger("greet").stream().map(BindingEngineTest::arrow).toList()
        );
        assertEquals("Unit 'greet' successfully activated", engine.explain("greet"));
    }

    @Test
    void failedBindIsIdempotent() {
        var engine = engine();
        var guarded = unit("secret", Guard.builder().actors("alice").build());
        engine.register(guarded);

        assertTrue(engine.bind(guarded, context("bob")).isEmpty());
        assertTrue(engine.bind(guarded, context("bob")).isEmpty());

        assertEquals(Set.of(), engine.satisfiedIds());
        assertEquals(2, engine.audit().failed("secret").size());
        assertEquals(1, engine.ledger("secret").size());
        assertEquals(
            "Unit 'secret' failed to activate:" + System.lineSeparator() + "  - actor: 'bob' not in [alice]",
            engine.explain("secret")
        );
    }

    @Test
    void dependenciesGateActivation() {
        var engine = engine();
        var a = unit("A", Guard.builder().actors("alice").build());
        var b = Unit.builder("B", "ACTION:test").dependsOn("A").build();
        var c = Unit.builder("C", "ACTION:test").dependsOn("B").build();
        engine.register(a);
        engine.register(b);
        engine.register(c);

        assertTrue(engine.bind(b, context("alice")).isEmpty());
        assertTrue(engine.audit().latest("B").orElseThrow().hasReason(ConditionKind.DEPENDENCY));

        assertTrue(engine.bind(a, context("alice")).isPresent());
        assertTrue(engine.bind(b, context("alice")).isPresent());
        assertTrue(engine.bind(c, context("alice")).isPresent());
        assertEquals(List.of("A", "B", "C"), List.copyOf(engine.satisfiedIds()));
    }

    @Test
    void expiredUnitLogsExpiryEveryAttempt() {
        var engine = engine();
        var offer = unit("offer", Guard.builder().temporal("before:2020-01-01").build());
        engine.register(offer);

        assertTrue(engine.bind(offer, context("alice")).isEmpty());
        assertTrue(engine.bind(offer, context("alice")).isEmpty());

        var transitions = engine.ledger("offer");
        assertEquals(3, transitions.size());
        assertEquals(UnitState.EXPIRED, transitions.get(1).to());
        assertEquals("Deadline passed", transitions.get(1).reason());
        assertEquals(UnitState.EXPIRED, transitions.get(2).to());
        assertEquals(2, engine.audit().stats().get("expired"));
    }

    @Test
    void weightComesFromPayload() {
        var engine = engine();
        var heavy = Unit.builder("heavy", "ACTION:lift").payload("weight", 2.5).build();
        var textual = Unit.builder("textual", "ACTION:lift").payload("weight", "3").build();
        var broken = Unit.builder("broken", "ACTION:lift").payload("weight", "very").build();

        assertEquals(2.5, engine.bind(heavy, context("a")).orElseThrow().weight());
        assertEquals(3.0, engine.bind(textual, context("a")).orElseThrow().weight());
        assertEquals(1.0, engine.bind(broken, context("a")).orElseThrow().weight());
    }

    @Test
    void bindManyRejectsUnknownIdsBeforeAnyAttempt() {
        var engine = engine();
        engine.register(unit("known"));

        var ex = assertThrows(UnknownUnitException.class, () -> engine.bindMany(List.of("known", "ghost"), context("a")));
        assertEquals("ghost", ex.unitId());
        assertEquals(0, engine.audit().size());

        var bound = engine.bindMany(List.of("known"), context("a"));
        assertEquals(1, bound.size());
    }

    @Test
    void cycleIsRejectedWithoutSideEffects() {
        var engine = engine();
        engine.register(Unit.builder("a", "ACTION:test").dependsOn("b").build());

        var ex = assertThrows(CircularDependencyException.class,
            () -> engine.register(Unit.builder("b", "ACTION:test").dependsOn("a").build()));

        assertEquals(List.of("a", "b", "a"), ex.cycle());
        assertEquals("Circular dependency detected: a -> b -> a", ex.getMessage());
        assertEquals(1, engine.registry().size());
        assertFalse(engine.registry().contains("b"));
        assertEquals(1, engine.ledger().size());
    }

    @Test
    void selfDependencyIsACycle() {
        var engine = engine();
        var ex = assertThrows(CircularDependencyException.class,
            () -> engine.register(Unit.builder("loop", "ACTION:test").dependsOn("loop").build()));
        assertEquals(List.of("loop", "loop"), ex.cycle());
        assertEquals(0, engine.registry().size());
    }

    @Test
    void reRegisteringReplacesDefinition() {
        var engine = engine();
        engine.register(Unit.builder("door", "ACTION:open").payload("v", 1).build());
        engine.register(Unit.builder("door", "ACTION:open").payload("v", 2).build());

        assertEquals(1, engine.registry().size());
        assertEquals(2, engine.registry().require("door").payload().get("v"));
        assertEquals(2, engine.ledger("door").size());
    }

    @Test
    void neverAttemptedExplanation() {
        var engine = engine();
        engine.register(unit("idle"));
        assertEquals("Unit 'idle' was never attempted for binding", engine.explain("idle"));
    }

    @Test
    void closeReleasesSinkOnce() {
        var sink = new InMemoryAuditSink();
        var engine = engine(sink);
        engine.register(unit("x"));
        engine.close();
        engine.close();

        assertTrue(sink.isClosed());
        assertTrue(engine.bind(unit("x"), context("a")).isPresent());
        assertEquals(0, sink.attempts().size());
        assertEquals(1, engine.audit().size());
    }

    private static String arrow(Transition transition) {
        return transition.from().wireName() + " -> " + transition.to().wireName();
    }
}
