package work.bindlang.api;

import java.util.List;
import java.util.Objects;
import work.bindlang.model.Context;
import work.bindlang.model.Unit;
import work.bindlang.orchestration.ActorTurn;

/**
 * Units plus a starting context, optionally followed by actor turns.
 *
 * @param evolve when {@code true} and no turns are given, sweeps repeat until nothing new binds
 */
public record Scenario(String name, List<Unit> units, Context context, List<ActorTurn> turns, boolean evolve) {
    public Scenario {
        name = name == null || name.isBlank() ? "scenario" : name;
        units = List.copyOf(units);
        Objects.requireNonNull(context, "context");
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public Mode mode() {
        if (!turns.isEmpty()) {
            return Mode.TURNS;
        }
        return evolve ? Mode.EVOLVE : Mode.SWEEP;
    }

    public enum Mode {
        SWEEP,
        EVOLVE,
        TURNS
    }
}
