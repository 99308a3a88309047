package work.bindlang.engine;

import work.bindlang.model.Context;

/**
 * Outcome of {@link BindingEngine#evolveUntilConverged}.
 */
public record ConvergenceResult(Context finalContext, int turnsUsed, boolean converged) {}
