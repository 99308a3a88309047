package work.bindlang.engine;

import java.util.List;
import java.util.Objects;
import work.bindlang.model.BoundResult;
import work.bindlang.model.Context;

/**
 * Outcome of one cascade call.
 *
 * @param bound        newly bound units, round-major then registry order
 * @param finalContext context after applied state mutations
 * @param roundsUsed   rounds executed, including the final round that bound nothing
 * @param converged    {@code true} when the cascade stopped at a fixed point rather than the cap
 */
public record SweepResult(List<BoundResult> bound, Context finalContext, int roundsUsed, boolean converged) {
    public SweepResult {
        bound = List.copyOf(bound);
        Objects.requireNonNull(finalContext, "finalContext");
    }

    public List<String> boundIds() {
        return bound.stream().map(BoundResult::unitId).toList();
    }
}
