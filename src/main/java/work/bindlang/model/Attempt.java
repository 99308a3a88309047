package work.bindlang.model;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record of one binding attempt, successful or not.
 */
public record Attempt(
    String unitId,
    LocalDateTime timestamp,
    Map<String, Object> contextSnapshot,
    boolean success,
    String boundResultId,
    List<FailureReason> failureReasons,
    List<StateChange> stateChanges
) {
    public Attempt {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(timestamp, "timestamp");
        contextSnapshot = contextSnapshot == null ? Map.of() : contextSnapshot;
        failureReasons = failureReasons == null ? List.of() : List.copyOf(failureReasons);
        stateChanges = stateChanges == null ? null : List.copyOf(stateChanges);
    }

    public static Attempt success(String unitId, LocalDateTime timestamp, Context context) {
        return new Attempt(unitId, timestamp, context.snapshot(), true, unitId, List.of(), null);
    }

    public static Attempt failure(String unitId, LocalDateTime timestamp, Context context, List<FailureReason> reasons) {
        return new Attempt(unitId, timestamp, context.snapshot(), false, null, reasons, null);
    }

    public Attempt withStateChanges(List<StateChange> changes) {
        return new Attempt(unitId, timestamp, contextSnapshot, success, boundResultId, failureReasons, changes);
    }

    public boolean hasReason(ConditionKind kind) {
        return failureReasons.stream().anyMatch(reason -> reason.kind() == kind);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("unitId", unitId);
        map.put("timestamp", timestamp.toString());
        map.put("context", contextSnapshot);
        map.put("success", success);
        map.put("boundResultId", boundResultId);
        map.put("failureReasons", failureReasons.stream().map(FailureReason::toSerializableMap).toList());
        map.put("stateChanges", stateChanges == null ? null : stateChanges.stream().map(StateChange::toSerializableMap).toList());
        return map;
    }
}
