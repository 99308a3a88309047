package work.bindlang.guard;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;

/**
 * Passes when every declared dependency is in the permanently satisfied set.
 */
public final class DependencyChecker implements GuardChecker {
    private final Set<String> satisfied;

    /**
     * @param satisfied live view of satisfied unit ids; read on every evaluation
     */
    public DependencyChecker(Set<String> satisfied) {
        this.satisfied = Objects.requireNonNull(satisfied, "satisfied");
    }

    @Override
    public boolean matches(Unit unit, Context context) {
        return satisfied.containsAll(unit.dependsOn());
    }

    @Override
    public Optional<FailureReason> check(Unit unit, Context context) {
        for (String dependency : unit.dependsOn()) {
            if (!satisfied.contains(dependency)) {
                return Optional.of(new FailureReason(
                    ConditionKind.DEPENDENCY,
                    dependency,
                    "not activated",
                    "dependency '" + dependency + "' not yet activated"
                ));
            }
        }
        return Optional.empty();
    }
}
