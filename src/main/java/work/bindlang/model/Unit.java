package work.bindlang.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Registered item of dormant payload awaiting a context that satisfies its guard.
 * Immutable; re-registering an id replaces the previous definition.
 */
public record Unit(
    String id,
    String type,
    Guard guard,
    Map<String, Object> payload,
    Map<String, Object> metadata,
    List<String> dependsOn,
    ConsumptionMode consumption
) {
    private static final Pattern TYPE_PATTERN = Pattern.compile("^[A-Z]+:[a-z_]+$");

    public Unit {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Unit id must not be blank");
        }
        Objects.requireNonNull(type, "type");
        if (!TYPE_PATTERN.matcher(type).matches()) {
            throw new IllegalArgumentException("Unit type must look like CATEGORY:name, got '" + type + "'");
        }
        guard = guard == null ? Guard.open() : guard;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        consumption = consumption == null ? ConsumptionMode.ONE_SHOT : consumption;
    }

    public static Builder builder(String id, String type) {
        return new Builder(id, type);
    }

    public boolean isReusable() {
        return consumption == ConsumptionMode.REUSABLE;
    }

    @Override
    public String toString() {
        return "Unit[" + id + " " + type + "]";
    }

    public static final class Builder {
        private final String id;
        private final String type;
        private Guard guard = Guard.open();
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private List<String> dependsOn = List.of();
        private ConsumptionMode consumption = ConsumptionMode.ONE_SHOT;

        private Builder(String id, String type) {
            this.id = id;
            this.type = type;
        }

        public Builder guard(Guard guard) {
            this.guard = guard;
            return this;
        }

        public Builder payload(String key, Object value) {
            payload.put(key, value);
            return this;
        }

        public Builder payload(Map<String, Object> values) {
            if (values != null) {
                payload.putAll(values);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> values) {
            if (values != null) {
                metadata.putAll(values);
            }
            return this;
        }

        public Builder dependsOn(String... ids) {
            this.dependsOn = Arrays.asList(ids);
            return this;
        }

        public Builder dependsOn(List<String> ids) {
            this.dependsOn = ids;
            return this;
        }

        public Builder consumption(ConsumptionMode mode) {
            this.consumption = mode;
            return this;
        }

        public Builder reusable() {
            return consumption(ConsumptionMode.REUSABLE);
        }

        public Unit build() {
            return new Unit(id, type, guard, payload, metadata, dependsOn, consumption);
        }
    }
}
