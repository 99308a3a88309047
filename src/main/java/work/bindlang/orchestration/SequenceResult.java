package work.bindlang.orchestration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.bindlang.model.BoundResult;

/**
 * Everything bound across an actor sequence, in binding order, plus the carried world-state.
 */
public record SequenceResult(List<BoundResult> bound, Map<String, Object> finalState) {
    public SequenceResult {
        bound = List.copyOf(bound);
        finalState = Collections.unmodifiableMap(new LinkedHashMap<>(finalState));
    }

    public List<String> boundIds() {
        return bound.stream().map(BoundResult::unitId).toList();
    }
}
