package work.bindlang.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adjacency map from unit id to its declared dependency ids. Dependencies on ids that are not
 * (yet) registered are allowed; they simply have no outgoing edges.
 */
final class DependencyGraph {
    private final Map<String, List<String>> edges;

    DependencyGraph() {
        this(new LinkedHashMap<>());
    }

    private DependencyGraph(Map<String, List<String>> edges) {
        this.edges = edges;
    }

    /**
     * Copy of this graph with {@code id}'s edges replaced.
     */
    DependencyGraph with(String id, List<String> dependsOn) {
        var next = new LinkedHashMap<>(edges);
        next.put(id, List.copyOf(dependsOn));
        return new DependencyGraph(next);
    }

    Map<String, List<String>> edges() {
        return Collections.unmodifiableMap(edges);
    }

    /**
     * Full depth-first scan of the graph. Returns the first cycle found as an ordered path whose
     * last element repeats the node that closed it.
     */
    Optional<List<String>> findCycle() {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        for (String node : edges.keySet()) {
            if (visited.contains(node)) continue;
            var cycle = visit(node, visited, onStack, new ArrayList<>());
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String node, Set<String> visited, Set<String> onStack, List<String> path) {
        visited.add(node);
        onStack.add(node);
        path.add(node);
        for (String neighbor : edges.getOrDefault(node, List.of())) {
            if (!visited.contains(neighbor)) {
                var cycle = visit(neighbor, visited, onStack, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            } else if (onStack.contains(neighbor)) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(neighbor), path.size()));
                cycle.add(neighbor);
                return Optional.of(cycle);
            }
        }
        onStack.remove(node);
        path.remove(path.size() - 1);
        return Optional.empty();
    }
}
