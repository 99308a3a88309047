package work.bindlang.guard;

import java.util.Optional;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;

/**
 * Evaluates the temporal mini-language. Parse and evaluation errors become diagnostics.
 */
public final class TemporalChecker implements GuardChecker {
    @Override
    public boolean matches(Unit unit, Context context) {
        return check(unit, context).isEmpty();
    }

    @Override
    public Optional<FailureReason> check(Unit unit, Context context) {
        String expression = unit.guard().temporal();
        if (expression == null) {
            return Optional.empty();
        }
        try {
            if (TemporalExpression.parse(expression).evaluate(context)) {
                return Optional.empty();
            }
        } catch (RuntimeException ex) {
            return Optional.of(new FailureReason(
                ConditionKind.TEMPORAL,
                expression,
                context.timestamp().toString(),
                "temporal: expression '" + expression + "' evaluation error: " + ex.getMessage()
            ));
        }
        return Optional.of(new FailureReason(
            ConditionKind.TEMPORAL,
            expression,
            context.timestamp().toString(),
            "temporal: condition '" + expression + "' not satisfied at " + context.timestamp()
        ));
    }
}
