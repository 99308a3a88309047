package work.bindlang.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unit that successfully bound against a context.
 *
 * @param stateChanges applied state mutations, {@code null} until the cascade applies some
 */
public record BoundResult(
    String unitId,
    String type,
    Map<String, Object> effect,
    double weight,
    LocalDateTime boundAt,
    Map<String, Object> contextSnapshot,
    List<StateChange> stateChanges
) {
    public BoundResult {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(boundAt, "boundAt");
        effect = effect == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(effect));
        contextSnapshot = contextSnapshot == null ? Map.of() : contextSnapshot;
        stateChanges = stateChanges == null ? null : List.copyOf(stateChanges);
    }

    public BoundResult withStateChanges(List<StateChange> changes) {
        return new BoundResult(unitId, type, effect, weight, boundAt, contextSnapshot, changes);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("unitId", unitId);
        map.put("type", type);
        map.put("effect", effect);
        map.put("weight", weight);
        map.put("boundAt", boundAt.toString());
        map.put("context", contextSnapshot);
        if (stateChanges != null) {
            map.put("stateChanges", stateChanges.stream().map(StateChange::toSerializableMap).toList());
        }
        return map;
    }
}
