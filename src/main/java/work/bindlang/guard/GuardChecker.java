package work.bindlang.guard;

import java.util.Optional;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;

/**
 * Evaluates one aspect of a unit's guard against a context.
 * <p>
 * {@link #matches} and {@link #check} must agree: {@code matches} is {@code true} exactly when
 * {@code check} returns empty.
 */
public sealed interface GuardChecker
    permits DependencyChecker, ExpirationChecker, ActorChecker, LocationChecker, StateChecker, TemporalChecker {

    /**
     * Cheap pass/fail without building a diagnostic.
     */
    boolean matches(Unit unit, Context context);

    /**
     * Full evaluation; empty on success, otherwise the diagnostic.
     */
    Optional<FailureReason> check(Unit unit, Context context);
}
