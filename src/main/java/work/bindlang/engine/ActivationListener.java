package work.bindlang.engine;

import work.bindlang.model.BoundResult;
import work.bindlang.model.Context;
import work.bindlang.model.Unit;

/**
 * Invoked synchronously after every successful bind.
 */
@FunctionalInterface
public interface ActivationListener {
    void onActivated(Unit unit, Context context, BoundResult bound);
}
