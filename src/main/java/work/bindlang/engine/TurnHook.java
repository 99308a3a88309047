package work.bindlang.engine;

import work.bindlang.model.Context;

/**
 * Lets callers inject state between macro-rounds of {@link BindingEngine#evolveUntilConverged}.
 */
@FunctionalInterface
public interface TurnHook {
    Context onTurnComplete(BindingEngine engine, Context context, int turn);
}
