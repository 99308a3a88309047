package work.bindlang.compose;

import java.util.List;
import java.util.Optional;
import work.bindlang.model.BoundResult;
import work.bindlang.model.Unit;

/**
 * Result of evaluating a {@link Bindable}.
 *
 * @param bound    the bound result (for parallel groups, the last child's)
 * @param boundAll every child's bound result, for parallel groups only
 * @param source   the unit that stayed latent, on failure
 */
public record BindingOutcome(Status status, BoundResult bound, List<BoundResult> boundAll, Unit source) {
    public enum Status {
        BOUND,
        LATENT
    }

    public BindingOutcome {
        boundAll = boundAll == null ? null : List.copyOf(boundAll);
    }

    public static BindingOutcome success(BoundResult bound) {
        return new BindingOutcome(Status.BOUND, bound, null, null);
    }

    public static BindingOutcome successAll(List<BoundResult> bound) {
        return new BindingOutcome(Status.BOUND, bound.get(bound.size() - 1), bound, null);
    }

    public static BindingOutcome stillLatent(Unit source) {
        return new BindingOutcome(Status.LATENT, null, null, source);
    }

    public boolean isBound() {
        return status == Status.BOUND;
    }

    public Optional<BoundResult> boundResult() {
        return Optional.ofNullable(bound);
    }
}
