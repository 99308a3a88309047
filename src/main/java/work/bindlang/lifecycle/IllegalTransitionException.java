package work.bindlang.lifecycle;

import work.bindlang.shared.StructuralViolationException;

/**
 * Raised when a transition outside the lifecycle table is recorded.
 */
public final class IllegalTransitionException extends StructuralViolationException {
    private final UnitState from;
    private final UnitState to;

    public IllegalTransitionException(UnitState from, UnitState to) {
        super("Invalid transition: " + name(from) + " -> " + name(to));
        this.from = from;
        this.to = to;
    }

    public UnitState from() {
        return from;
    }

    public UnitState to() {
        return to;
    }

    private static String name(UnitState state) {
        return state == null ? "null" : state.wireName();
    }
}
