package work.bindlang.compose;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import work.bindlang.engine.BindingEngine;
import work.bindlang.model.Context;
import work.bindlang.model.Unit;

/**
 * Lazily evaluated composition tree over units. Building a tree never binds anything;
 * evaluation happens only through {@link #tryBind}.
 */
public sealed interface Bindable permits Bindable.Atomic, Bindable.Alternative, Bindable.Sequential, Bindable.Parallel {

    static Atomic of(Unit unit) {
        return new Atomic(unit);
    }

    static Parallel allOf(Bindable... children) {
        return new Parallel(Arrays.asList(children));
    }

    /**
     * {@code this | other}: first bound result wins, otherwise {@code other}'s outcome.
     */
    default Alternative or(Bindable other) {
        return new Alternative(this, other);
    }

    /**
     * {@code this >> other}: {@code other} is only attempted once {@code this} bound.
     */
    default Sequential then(Bindable other) {
        return new Sequential(this, other);
    }

    /**
     * {@code this & other}: every child is attempted; all must bind.
     */
    default Parallel and(Bindable other) {
        return new Parallel(List.of(this, other));
    }

    default BindingOutcome tryBind(Context context, BindingEngine engine) {
        return BindableEvaluator.evaluate(this, context, engine);
    }

    record Atomic(Unit unit) implements Bindable {
        public Atomic {
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String toString() {
            return "Sym(" + unit.id() + ")";
        }
    }

    record Alternative(Bindable left, Bindable right) implements Bindable {
        public Alternative {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " | " + right + ")";
        }
    }

    record Sequential(Bindable first, Bindable second) implements Bindable {
        public Sequential {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }

        @Override
        public String toString() {
            return "(" + first + " >> " + second + ")";
        }
    }

    record Parallel(List<Bindable> children) implements Bindable {
        public Parallel {
            if (children == null || children.isEmpty()) {
                throw new IllegalArgumentException("Parallel requires at least one child");
            }
            children = List.copyOf(children);
        }

        /**
         * Appends to this group instead of nesting, so {@code a & b & c} has three children.
         */
        @Override
        public Parallel and(Bindable other) {
            var next = new ArrayList<>(children);
            next.add(other);
            return new Parallel(next);
        }

        @Override
        public String toString() {
            return "(" + String.join(" & ", children.stream().map(Object::toString).toList()) + ")";
        }
    }
}
