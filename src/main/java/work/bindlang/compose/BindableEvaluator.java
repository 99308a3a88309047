package work.bindlang.compose;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.bindlang.engine.BindingEngine;
import work.bindlang.model.BoundResult;
import work.bindlang.model.Context;

/**
 * Depth-first, left-to-right evaluation of composition trees. Every atomic attempt goes
 * through {@link BindingEngine#bind} and is recorded there.
 */
public final class BindableEvaluator {
    private BindableEvaluator() {}

    public static BindingOutcome evaluate(Bindable node, Context context, BindingEngine engine) {
        Objects.requireNonNull(node, "node");
        if (node instanceof Bindable.Atomic atomic) {
            return engine.bind(atomic.unit(), context)
                .map(BindingOutcome::success)
                .orElseGet(() -> BindingOutcome.stillLatent(atomic.unit()));
        }
        if (node instanceof Bindable.Alternative alternative) {
            var left = evaluate(alternative.left(), context, engine);
            if (left.isBound()) {
                return left;
            }
            return evaluate(alternative.right(), context, engine);
        }
        if (node instanceof Bindable.Sequential sequential) {
            var first = evaluate(sequential.first(), context, engine);
            if (!first.isBound()) {
                return first;
            }
            return evaluate(sequential.second(), context, engine);
        }
        if (node instanceof Bindable.Parallel parallel) {
            List<BindingOutcome> outcomes = new ArrayList<>();
            for (Bindable child : parallel.children()) {
                outcomes.add(evaluate(child, context, engine));
            }
            for (BindingOutcome outcome : outcomes) {
                if (!outcome.isBound()) {
                    return outcome;
                }
            }
            List<BoundResult> bound = outcomes.stream().map(BindingOutcome::bound).toList();
            return BindingOutcome.successAll(bound);
        }
        throw new IllegalStateException("Unsupported bindable: " + node.getClass().getName());
    }
}
