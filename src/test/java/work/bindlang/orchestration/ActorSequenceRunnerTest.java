package work.bindlang.orchestration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.bindlang.support.EngineTestSupport.NOW;
import static work.bindlang.support.EngineTestSupport.engine;
import static work.bindlang.support.EngineTestSupport.fixedClock;
import static work.bindlang.support.EngineTestSupport.state;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.bindlang.engine.BindingEngine;
import work.bindlang.model.Guard;
import work.bindlang.model.Unit;

class ActorSequenceRunnerTest {
    private static final LocalDateTime NINE = LocalDateTime.of(2025, 11, 19, 9, 0);

    private static BindingEngine labEngine() {
        var engine = engine();
        engine.register(Unit.builder("open_lab", "EVENT:lab_open")
            .guard(Guard.builder().state("labOpen", false).build())
            .payload("state_mutation", Map.of("labOpen", true))
            .build());
        engine.register(Unit.builder("a_arrives", "EVENT:arrival")
            .guard(Guard.builder().actors("researcher_a").state("labOpen", true).build())
            .payload("state_mutation", Map.of("aPresent", true))
            .build());
        engine.register(Unit.builder("b_arrives", "EVENT:arrival")
            .guard(Guard.builder().actors("researcher_b").state("labOpen", true).build())
            .payload("state_mutation", Map.of("bPresent", true))
            .build());
        engine.register(Unit.builder("collaborate", "EVENT:collaboration")
            .guard(Guard.builder().locations("main_lab").state("aPresent", true).state("bPresent", true).build())
            .build());
        return engine;
    }

    @Test
    void stateCarriesAcrossPerspectives() {
        var runner = new ActorSequenceRunner(labEngine());

        var result = runner.run(List.of(
            ActorTurn.system("lab_entrance"),
            ActorTurn.of("researcher_a", "lab_entrance"),
            ActorTurn.of("researcher_b", "lab_entrance"),
            ActorTurn.system("main_lab")
        ), state("labOpen", false), NINE);

        assertEquals(List.of("open_lab", "a_arrives", "b_arrives", "collaborate"), result.boundIds());
        assertEquals(Map.of("labOpen", true, "aPresent", true, "bPresent", true), result.finalState());
    }

    @Test
    void wrongOrderLeavesCollaborationLatent() {
        var runner = new ActorSequenceRunner(labEngine());

        var result = runner.run(List.of(
            ActorTurn.system("main_lab"),
            ActorTurn.of("researcher_a", "lab_entrance")
        ), state("labOpen", false), NINE);

        assertEquals(List.of("open_lab", "a_arrives"), result.boundIds());
    }

    @Test
    void timelineUsesTurnTimestamps() {
        var engine = engine();
        engine.register(Unit.builder("late_b", "EVENT:arrival")
            .guard(Guard.builder().actors("researcher_b").temporal("after:2025-11-19T09:07:00").build())
            .build());
        engine.register(Unit.builder("early_a", "EVENT:arrival")
            .guard(Guard.builder().actors("researcher_a").temporal("before:2025-11-19T09:07:00").build())
            .build());

        var result = new ActorSequenceRunner(engine).runTimeline(List.of(
            ActorTurn.at(NINE, null, "lab_entrance"),
            ActorTurn.at(NINE.plusMinutes(5), "researcher_a", "lab_entrance"),
            ActorTurn.at(NINE.plusMinutes(10), "researcher_b", "lab_entrance")
        ), Map.of());

        assertEquals(List.of("early_a", "late_b"), result.boundIds());
        assertEquals("2025-11-19T09:10", result.bound().get(1).contextSnapshot().get("timestamp"));
    }

    @Test
    void timelineRequiresTimestamps() {
        var runner = new ActorSequenceRunner(engine());
        assertThrows(IllegalArgumentException.class,
            () -> runner.runTimeline(List.of(ActorTurn.of("a", "here")), Map.of()));
    }

    @Test
    void defaultsToRunnerClock() {
        var engine = engine();
        engine.register(Unit.builder("any", "EVENT:tick").build());

        var result = new ActorSequenceRunner(engine, fixedClock()).run(List.of(ActorTurn.system(null)), null);

        assertEquals(NOW.toString(), result.bound().get(0).contextSnapshot().get("timestamp"));
        assertEquals(Map.of(), result.finalState());
    }
}
