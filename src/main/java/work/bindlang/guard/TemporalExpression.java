package work.bindlang.guard;

import java.time.LocalDateTime;
import java.util.Objects;
import work.bindlang.model.Context;
import work.bindlang.shared.IsoTimestamps;
import work.bindlang.shared.Values;

/**
 * Parsed form of {@code "<after|before>:<reference>"}. A reference starting with a digit is an
 * ISO-8601 datetime compared against the context timestamp; anything else names a state key
 * whose value is tested for truthiness.
 */
public sealed interface TemporalExpression permits TemporalExpression.Absolute, TemporalExpression.StateReference {

    boolean evaluate(Context context);

    static TemporalExpression parse(String expression) {
        if (expression == null) {
            throw new TemporalExpressionException("Temporal expression must not be null");
        }
        int separator = expression.indexOf(':');
        if (separator < 0) {
            throw new TemporalExpressionException("Invalid temporal expression: '" + expression + "' (missing ':')");
        }
        var operator = TemporalOperator.parse(expression.substring(0, separator));
        var reference = expression.substring(separator + 1);
        if (reference.isBlank()) {
            throw new TemporalExpressionException("Invalid temporal expression: '" + expression + "' (empty reference)");
        }
        if (Character.isDigit(reference.charAt(0))) {
            try {
                return new Absolute(operator, IsoTimestamps.parse(reference));
            } catch (IllegalArgumentException ex) {
                throw new TemporalExpressionException("Invalid ISO datetime: '" + reference + "'", ex);
            }
        }
        return new StateReference(operator, reference);
    }

    /**
     * Comparison against a fixed instant; both bounds are exclusive.
     */
    record Absolute(TemporalOperator operator, LocalDateTime reference) implements TemporalExpression {
        public Absolute {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(reference, "reference");
        }

        @Override
        public boolean evaluate(Context context) {
            return switch (operator) {
                case AFTER -> context.timestamp().isAfter(reference);
                case BEFORE -> context.timestamp().isBefore(reference);
            };
        }
    }

    /**
     * Symbolic reference into context state. The operator is kept for display only.
     */
    record StateReference(TemporalOperator operator, String stateKey) implements TemporalExpression {
        public StateReference {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(stateKey, "stateKey");
        }

        @Override
        public boolean evaluate(Context context) {
            return Values.isTruthy(context.stateValue(stateKey));
        }
    }
}
