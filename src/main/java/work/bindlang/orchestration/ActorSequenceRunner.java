package work.bindlang.orchestration;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.bindlang.engine.BindingEngine;
import work.bindlang.model.BoundResult;
import work.bindlang.model.Context;

/**
 * Replays a cascade sweep once per actor perspective, carrying the world-state produced by
 * each sweep into the next turn.
 */
public final class ActorSequenceRunner {
    private static final Logger log = LoggerFactory.getLogger(ActorSequenceRunner.class);

    private final BindingEngine engine;
    private final Clock clock;

    public ActorSequenceRunner(BindingEngine engine) {
        this(engine, Clock.systemDefaultZone());
    }

    public ActorSequenceRunner(BindingEngine engine, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SequenceResult run(List<ActorTurn> turns, Map<String, Object> initialState) {
        return run(turns, initialState, null);
    }

    /**
     * Runs one mutation-applying sweep per turn. Turns without their own timestamp use
     * {@code initialTimestamp}, or the runner clock when that is {@code null} too.
     */
    public SequenceResult run(List<ActorTurn> turns, Map<String, Object> initialState, LocalDateTime initialTimestamp) {
        Objects.requireNonNull(turns, "turns");
        var start = initialTimestamp != null ? initialTimestamp : LocalDateTime.now(clock);
        Map<String, Object> state = initialState == null ? new LinkedHashMap<>() : new LinkedHashMap<>(initialState);
        List<BoundResult> bound = new ArrayList<>();

        int index = 0;
        for (ActorTurn turn : turns) {
            var when = turn.timestamp() != null ? turn.timestamp() : start;
            var context = new Context(turn.actor(), when, turn.location(), state);
            var sweep = engine.sweep(context, engine.settings().maxRounds(), true);
            bound.addAll(sweep.bound());
            state = new LinkedHashMap<>(sweep.finalContext().state());
            log.debug("Turn {} ({}) bound {}", index++, turn.actor() == null ? "system" : turn.actor(), sweep.boundIds());
        }
        return new SequenceResult(bound, state);
    }

    /**
     * Same as {@link #run(List, Map, LocalDateTime)} with every turn carrying an explicit time.
     */
    public SequenceResult runTimeline(List<ActorTurn> timeline, Map<String, Object> initialState) {
        for (ActorTurn turn : timeline) {
            if (turn.timestamp() == null) {
                throw new IllegalArgumentException("Timeline entries need a timestamp (actor " + turn.actor() + ")");
            }
        }
        return run(timeline, initialState, null);
    }
}
