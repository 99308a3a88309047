package work.bindlang.lifecycle;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only ordered log of lifecycle transitions.
 */
public final class TransitionLedger {
    private final List<Transition> entries = new ArrayList<>();
    private final Clock clock;

    public TransitionLedger(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Transition record(String unitId, UnitState from, UnitState to, String reason) {
        var transition = new Transition(unitId, from, to, LocalDateTime.now(clock), reason);
        entries.add(transition);
        return transition;
    }

    public List<Transition> entries() {
        return List.copyOf(entries);
    }

    public List<Transition> entries(String unitId) {
        if (unitId == null) {
            return entries();
        }
        return entries.stream().filter(t -> t.unitId().equals(unitId)).toList();
    }

    /**
     * State reached by the most recent transition for {@code unitId}, if any was recorded.
     */
    public Optional<UnitState> latestState(String unitId) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            var entry = entries.get(i);
            if (entry.unitId().equals(unitId)) {
                return Optional.of(entry.to());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }
}
