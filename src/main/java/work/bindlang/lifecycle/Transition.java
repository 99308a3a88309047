package work.bindlang.lifecycle;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One recorded lifecycle transition. Construction fails for transitions the table rejects,
 * so a ledger of {@code Transition} values is always self-consistent.
 */
public record Transition(String unitId, UnitState from, UnitState to, LocalDateTime timestamp, String reason) {
    public Transition {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!LifecycleRules.isLegal(from, to)) {
            throw new IllegalTransitionException(from, to);
        }
        reason = reason == null ? "" : reason;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("unitId", unitId);
        map.put("from", from.wireName());
        map.put("to", to.wireName());
        map.put("timestamp", timestamp.toString());
        map.put("reason", reason);
        return map;
    }
}
