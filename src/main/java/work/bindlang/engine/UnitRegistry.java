package work.bindlang.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.bindlang.model.Unit;

/**
 * Units keyed by id in insertion order, plus the dependency graph over them.
 * The graph is re-validated in full on every registration; a rejected registration leaves
 * the registry untouched.
 */
public final class UnitRegistry {
    private final Map<String, Unit> units = new LinkedHashMap<>();
    private DependencyGraph graph = new DependencyGraph();

    /**
     * @return {@code true} when the id was new, {@code false} when an existing unit was replaced
     * @throws CircularDependencyException if the unit's dependencies close a cycle
     */
    boolean register(Unit unit) {
        var candidate = graph.with(unit.id(), unit.dependsOn());
        var cycle = candidate.findCycle();
        if (cycle.isPresent()) {
            throw new CircularDependencyException(cycle.get());
        }
        graph = candidate;
        return units.put(unit.id(), unit) == null;
    }

    public Optional<Unit> find(String id) {
        return Optional.ofNullable(units.get(id));
    }

    public Unit require(String id) {
        var unit = units.get(id);
        if (unit == null) {
            throw new UnknownUnitException(id);
        }
        return unit;
    }

    public boolean contains(String id) {
        return units.containsKey(id);
    }

    /**
     * Snapshot of registered units in insertion order.
     */
    public List<Unit> units() {
        return List.copyOf(units.values());
    }

    public Map<String, List<String>> dependencyGraph() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(graph.edges()));
    }

    public int size() {
        return units.size();
    }
}
