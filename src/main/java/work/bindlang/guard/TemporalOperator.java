package work.bindlang.guard;

import java.util.Locale;

/**
 * The two operators of the temporal mini-language.
 */
public enum TemporalOperator {
    AFTER,
    BEFORE;

    public String literal() {
        return name().toLowerCase(Locale.ROOT);
    }

    static TemporalOperator parse(String raw) {
        for (TemporalOperator operator : values()) {
            if (operator.literal().equals(raw)) {
                return operator;
            }
        }
        throw new TemporalExpressionException("Invalid operator: '" + raw + "' (must be 'after' or 'before')");
    }
}
