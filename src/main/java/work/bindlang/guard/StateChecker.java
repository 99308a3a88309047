package work.bindlang.guard;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;
import work.bindlang.shared.Values;

/**
 * Every guard state key must equal the context value; a missing context key reads as {@code null}.
 * Only the first mismatching key is reported.
 */
public final class StateChecker implements GuardChecker {
    @Override
    public boolean matches(Unit unit, Context context) {
        return firstMismatch(unit, context).isEmpty();
    }

    @Override
    public Optional<FailureReason> check(Unit unit, Context context) {
        return firstMismatch(unit, context).map(entry -> {
            String key = entry.getKey();
            Object actual = context.stateValue(key);
            Map<String, Object> expected = new LinkedHashMap<>();
            expected.put(key, entry.getValue());
            Map<String, Object> observed = new LinkedHashMap<>();
            observed.put(key, actual);
            return new FailureReason(
                ConditionKind.STATE,
                expected,
                observed,
                "state['" + key + "']: expected " + entry.getValue() + ", got " + actual
            );
        });
    }

    private static Optional<Map.Entry<String, Object>> firstMismatch(Unit unit, Context context) {
        var guard = unit.guard();
        if (!guard.hasState()) {
            return Optional.empty();
        }
        for (var entry : guard.state().entrySet()) {
            if (!Values.strictEquals(entry.getValue(), context.stateValue(entry.getKey()))) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
