package work.bindlang.model;

import java.util.Locale;

/**
 * Whether a bound unit may bind again in later rounds of the same cascade call.
 */
public enum ConsumptionMode {
    ONE_SHOT("one_shot"),
    REUSABLE("reusable");

    private final String literal;

    ConsumptionMode(String literal) {
        this.literal = literal;
    }

    public String literal() {
        return literal;
    }

    public static ConsumptionMode from(String value) {
        if (value == null || value.isBlank()) {
            return ONE_SHOT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ConsumptionMode mode : values()) {
            if (mode.literal.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("consumption must be 'one_shot' or 'reusable', got '" + value + "'");
    }
}
