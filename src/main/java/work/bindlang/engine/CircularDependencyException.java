package work.bindlang.engine;

import java.util.List;
import work.bindlang.shared.StructuralViolationException;

/**
 * Raised when registering a unit would make the dependency graph cyclic.
 */
public final class CircularDependencyException extends StructuralViolationException {
    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Ordered path of ids; the first id is repeated at the end.
     */
    public List<String> cycle() {
        return cycle;
    }
}
