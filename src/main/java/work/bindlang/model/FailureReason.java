package work.bindlang.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured explanation of a single failed guard condition.
 */
public record FailureReason(ConditionKind kind, Object expected, Object actual, String message) {
    public FailureReason {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("condition", kind.wireName());
        map.put("expected", expected);
        map.put("actual", actual);
        map.put("message", message);
        return map;
    }
}
