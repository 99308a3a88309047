package work.bindlang.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Conjunctive activation predicate. A {@code null} (or empty) field is vacuously true.
 *
 * @param actors    accepted actors
 * @param temporal  {@code "<after|before>:<reference>"} expression
 * @param locations accepted locations
 * @param state     required state values, compared by strict equality
 */
public record Guard(Set<String> actors, String temporal, Set<String> locations, Map<String, Object> state) {
    private static final Guard OPEN = new Guard(null, null, null, null);

    public Guard {
        actors = actors == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(actors));
        temporal = temporal == null || temporal.isBlank() ? null : temporal.trim();
        locations = locations == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(locations));
        state = state == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static Guard open() {
        return OPEN;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasActors() {
        return actors != null && !actors.isEmpty();
    }

    public boolean hasTemporal() {
        return temporal != null;
    }

    public boolean hasLocations() {
        return locations != null && !locations.isEmpty();
    }

    public boolean hasState() {
        return state != null && !state.isEmpty();
    }

    public static final class Builder {
        private Set<String> actors;
        private String temporal;
        private Set<String> locations;
        private Map<String, Object> state;

        public Builder actors(String... values) {
            return actors(Arrays.asList(values));
        }

        public Builder actors(Collection<String> values) {
            this.actors = values == null ? null : new LinkedHashSet<>(values);
            return this;
        }

        public Builder temporal(String expression) {
            this.temporal = expression;
            return this;
        }

        public Builder locations(String... values) {
            return locations(Arrays.asList(values));
        }

        public Builder locations(Collection<String> values) {
            this.locations = values == null ? null : new LinkedHashSet<>(values);
            return this;
        }

        public Builder state(String key, Object value) {
            if (state == null) {
                state = new LinkedHashMap<>();
            }
            state.put(key, value);
            return this;
        }

        public Builder state(Map<String, Object> values) {
            this.state = values == null ? null : new LinkedHashMap<>(values);
            return this;
        }

        public Guard build() {
            return new Guard(actors, temporal, locations, state);
        }
    }
}
