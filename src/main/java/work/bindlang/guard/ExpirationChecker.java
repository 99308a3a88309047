package work.bindlang.guard;

import java.util.Optional;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;

/**
 * Detects units whose absolute {@code before:} deadline has passed. Symbolic {@code before:}
 * references never expire, and malformed expressions are left to {@link TemporalChecker}.
 */
public final class ExpirationChecker implements GuardChecker {
    private static final String BEFORE_PREFIX = TemporalOperator.BEFORE.literal() + ":";

    @Override
    public boolean matches(Unit unit, Context context) {
        return deadline(unit)
            .map(deadline -> deadline.evaluate(context))
            .orElse(true);
    }

    @Override
    public Optional<FailureReason> check(Unit unit, Context context) {
        return deadline(unit)
            .filter(deadline -> !deadline.evaluate(context))
            .map(deadline -> new FailureReason(
                ConditionKind.EXPIRED,
                "before " + deadline.reference(),
                context.timestamp().toString(),
                "unit expired: deadline '" + deadline.reference() + "' has passed"
            ));
    }

    private static Optional<TemporalExpression.Absolute> deadline(Unit unit) {
        String expression = unit.guard().temporal();
        if (expression == null || !expression.startsWith(BEFORE_PREFIX)) {
            return Optional.empty();
        }
        try {
            if (TemporalExpression.parse(expression) instanceof TemporalExpression.Absolute absolute) {
                return Optional.of(absolute);
            }
            return Optional.empty();
        } catch (TemporalExpressionException ex) {
            return Optional.empty();
        }
    }
}
