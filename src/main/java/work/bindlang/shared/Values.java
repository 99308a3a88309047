package work.bindlang.shared;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Small helpers for comparing and testing loosely typed state values.
 */
public final class Values {
    private Values() {}

    /**
     * Truthiness used by symbolic temporal references: null, false, zero, and empty
     * strings/collections/maps are falsy; everything else is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number num) {
            if (isNonFinite(num)) {
                return true;
            }
            return toDecimal(num).signum() != 0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    /**
     * Strict equality: same value, with numbers compared numerically regardless of boxing type
     * (an {@code Integer 1} equals a {@code Long 1}); booleans never equal numbers. NaN equals
     * nothing, infinities equal only the same infinity.
     */
    public static boolean strictEquals(Object expected, Object actual) {
        if (expected instanceof Number left && actual instanceof Number right) {
            if (isNonFinite(left) || isNonFinite(right)) {
                return left.doubleValue() == right.doubleValue();
            }
            return toDecimal(left).compareTo(toDecimal(right)) == 0;
        }
        return Objects.equals(expected, actual);
    }

    private static boolean isNonFinite(Number number) {
        return (number instanceof Double || number instanceof Float) && !Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}
