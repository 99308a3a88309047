package work.bindlang.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import work.bindlang.model.Attempt;
import work.bindlang.model.FailureReason;
import work.bindlang.model.StateChange;

/**
 * Append-only in-memory log of binding attempts with diagnostic queries.
 */
public final class AuditTrail {
    private final List<Attempt> entries = new ArrayList<>();

    public void record(Attempt attempt) {
        entries.add(attempt);
    }

    public List<Attempt> attempts() {
        return List.copyOf(entries);
    }

    public List<Attempt> attempts(String unitId) {
        if (unitId == null) {
            return attempts();
        }
        return entries.stream().filter(a -> a.unitId().equals(unitId)).toList();
    }

    public List<Attempt> failed(String unitId) {
        return entries.stream().filter(a -> a.unitId().equals(unitId) && !a.success()).toList();
    }

    public List<Attempt> failures() {
        return entries.stream().filter(a -> !a.success()).toList();
    }

    public Optional<Attempt> latest(String unitId) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).unitId().equals(unitId)) {
                return Optional.of(entries.get(i));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Human-readable account of the most recent attempt for {@code unitId}.
     */
    public String explain(String unitId) {
        var latest = latest(unitId);
        if (latest.isEmpty()) {
            return "Unit '" + unitId + "' was never attempted for binding";
        }
        var attempt = latest.get();
        if (attempt.success()) {
            return "Unit '" + unitId + "' successfully activated";
        }
        if (attempt.failureReasons().isEmpty()) {
            return "Unit '" + unitId + "' failed to activate (no specific reason recorded)";
        }
        var text = new StringBuilder("Unit '").append(unitId).append("' failed to activate:");
        for (FailureReason reason : attempt.failureReasons()) {
            text.append(System.lineSeparator()).append("  - ").append(reason.message());
        }
        return text.toString();
    }

    /**
     * Failure counts keyed by condition wire name.
     */
    public Map<String, Integer> stats() {
        Map<String, Integer> stats = new TreeMap<>();
        for (Attempt attempt : entries) {
            if (attempt.success()) continue;
            for (FailureReason reason : attempt.failureReasons()) {
                stats.merge(reason.kind().wireName(), 1, Integer::sum);
            }
        }
        return stats;
    }

    /**
     * Replaces the most recent successful attempt of {@code unitId} with a copy carrying the
     * applied state changes. Returns the updated attempt, if one was found.
     */
    public Optional<Attempt> attachStateChanges(String unitId, List<StateChange> changes) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            var entry = entries.get(i);
            if (entry.unitId().equals(unitId) && entry.success()) {
                var updated = entry.withStateChanges(changes);
                entries.set(i, updated);
                return Optional.of(updated);
            }
        }
        return Optional.empty();
    }
}
