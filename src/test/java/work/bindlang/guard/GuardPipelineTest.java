package work.bindlang.guard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.bindlang.support.EngineTestSupport.context;
import static work.bindlang.support.EngineTestSupport.state;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Guard;
import work.bindlang.model.Unit;

class GuardPipelineTest {
    @Test
    void evaluateCollectsEveryFailureInOrder() {
        var pipeline = new GuardPipeline(Set.of());
        var unit = Unit.builder("vault", "ACTION:enter")
            .dependsOn("door")
            .guard(Guard.builder()
                .actors("bob")
                .locations("vault")
                .state("hasKey", true)
                .temporal("before:2020-01-01")
                .build())
            .build();

        var kinds = pipeline.evaluate(unit, context("alice")).stream().map(FailureReason::kind).toList();
        assertEquals(List.of(
            ConditionKind.DEPENDENCY,
            ConditionKind.EXPIRED,
            ConditionKind.ACTOR,
            ConditionKind.LOCATION,
            ConditionKind.STATE,
            ConditionKind.TEMPORAL
        ), kinds);
        assertFalse(pipeline.prefilter(unit, context("alice")));
    }

    @Test
    void prefilterAgreesWithFullEvaluation() {
        var pipeline = new GuardPipeline(Set.of("door"));
        var unit = Unit.builder("vault", "ACTION:enter")
            .dependsOn("door")
            .guard(Guard.builder().actors("alice").state("hasKey", true).temporal("before:2099-01-01").build())
            .build();

        var blocked = context("alice", state("hasKey", false));
        var allowed = context("alice", state("hasKey", true));
        assertFalse(pipeline.prefilter(unit, blocked));
        assertFalse(pipeline.evaluate(unit, blocked).isEmpty());
        assertTrue(pipeline.prefilter(unit, allowed));
        assertTrue(pipeline.evaluate(unit, allowed).isEmpty());
    }

    @Test
    void checkersRunInFixedOrder() {
        var names = new GuardPipeline(Set.of()).checkers().stream().map(c -> c.getClass().getSimpleName()).toList();
        assertEquals(List.of(
            "DependencyChecker",
            "ExpirationChecker",
            "ActorChecker",
            "LocationChecker",
            "StateChecker",
            "TemporalChecker"
        ), names);
    }
}
