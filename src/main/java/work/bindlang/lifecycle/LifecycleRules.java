package work.bindlang.lifecycle;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal-transition table. Activated may return to Dormant for reusable units; Expired and
 * Archived are terminal.
 */
public final class LifecycleRules {
    private static final Map<UnitState, Set<UnitState>> TRANSITIONS = new EnumMap<>(UnitState.class);

    static {
        TRANSITIONS.put(UnitState.CREATED, EnumSet.of(UnitState.DORMANT));
        TRANSITIONS.put(UnitState.DORMANT, EnumSet.of(UnitState.ACTIVATED, UnitState.EXPIRED));
        TRANSITIONS.put(UnitState.ACTIVATED, EnumSet.of(UnitState.ARCHIVED, UnitState.DORMANT));
    }

    private LifecycleRules() {}

    public static boolean isLegal(UnitState from, UnitState to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public static Set<UnitState> reachableFrom(UnitState from) {
        var targets = TRANSITIONS.get(from);
        return targets == null ? Set.of() : EnumSet.copyOf(targets);
    }

    public static boolean isTerminal(UnitState state) {
        return reachableFrom(state).isEmpty();
    }
}
