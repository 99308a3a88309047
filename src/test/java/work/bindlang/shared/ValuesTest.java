package work.bindlang.shared;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {
    @Test
    void falsyValues() {
        assertFalse(Values.isTruthy(null));
        assertFalse(Values.isTruthy(false));
        assertFalse(Values.isTruthy(0));
        assertFalse(Values.isTruthy(0.0));
        assertFalse(Values.isTruthy(""));
        assertFalse(Values.isTruthy(List.of()));
        assertFalse(Values.isTruthy(Map.of()));
    }

    @Test
    void truthyValues() {
        assertTrue(Values.isTruthy(true));
        assertTrue(Values.isTruthy(1));
        assertTrue(Values.isTruthy(-0.5));
        assertTrue(Values.isTruthy("no"));
        assertTrue(Values.isTruthy(List.of(1)));
        assertTrue(Values.isTruthy(new Object()));
    }

    @Test
    void numbersCompareAcrossBoxedTypes() {
        assertTrue(Values.strictEquals(1, 1L));
        assertTrue(Values.strictEquals(2.5, new BigDecimal("2.50")));
        assertFalse(Values.strictEquals(1, 2));
    }

    @Test
    void booleansNeverEqualNumbers() {
        assertFalse(Values.strictEquals(true, 1));
        assertFalse(Values.strictEquals(0, false));
        assertTrue(Values.strictEquals(null, null));
        assertFalse(Values.strictEquals("1", 1));
    }

    @Test
    void nonFiniteNumbersAreTruthy() {
        assertTrue(Values.isTruthy(Double.NaN));
        assertTrue(Values.isTruthy(Double.POSITIVE_INFINITY));
        assertTrue(Values.isTruthy(Float.NEGATIVE_INFINITY));
    }

    @Test
    void nonFiniteNumbersCompareWithoutFailing() {
        assertFalse(Values.strictEquals(Double.NaN, Double.NaN));
        assertFalse(Values.strictEquals(1.5, Double.NaN));
        assertFalse(Values.strictEquals(Double.POSITIVE_INFINITY, 1));
        assertTrue(Values.strictEquals(Double.POSITIVE_INFINITY, Float.POSITIVE_INFINITY));
        assertFalse(Values.strictEquals(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY));
    }
}
