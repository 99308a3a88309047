package work.bindlang.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of actor, time, location and world-state used for guard evaluation.
 * State updates always return a new instance.
 *
 * @param actor     acting perspective, {@code null} for the system perspective
 * @param timestamp evaluation time
 * @param location  where the evaluation happens
 * @param state     world-state; values may be {@code null}
 */
public record Context(String actor, LocalDateTime timestamp, String location, Map<String, Object> state) {
    public Context {
        Objects.requireNonNull(timestamp, "timestamp");
        location = location == null ? "" : location;
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static Context of(String actor, LocalDateTime timestamp, String location) {
        return new Context(actor, timestamp, location, Map.of());
    }

    public Object stateValue(String key) {
        return state.get(key);
    }

    public Context withState(String key, Object value) {
        var next = new LinkedHashMap<>(state);
        next.put(key, value);
        return new Context(actor, timestamp, location, next);
    }

    public Context withState(Map<String, Object> values) {
        var next = new LinkedHashMap<>(state);
        next.putAll(values);
        return new Context(actor, timestamp, location, next);
    }

    public Context withActor(String newActor) {
        return new Context(newActor, timestamp, location, state);
    }

    public Context withLocation(String newLocation) {
        return new Context(actor, timestamp, newLocation, state);
    }

    public Context withTimestamp(LocalDateTime newTimestamp) {
        return new Context(actor, newTimestamp, location, state);
    }

    /**
     * JSON-friendly copy of this context (timestamp rendered as ISO-8601).
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("actor", actor);
        snapshot.put("timestamp", timestamp.toString());
        snapshot.put("location", location);
        snapshot.put("state", new LinkedHashMap<>(state));
        return Collections.unmodifiableMap(snapshot);
    }
}
