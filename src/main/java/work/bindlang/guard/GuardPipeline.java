package work.bindlang.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;

/**
 * The six guard checkers in their fixed cheap-to-expensive order.
 */
public final class GuardPipeline {
    private final DependencyChecker dependency;
    private final ExpirationChecker expiration = new ExpirationChecker();
    private final ActorChecker actor = new ActorChecker();
    private final LocationChecker location = new LocationChecker();
    private final StateChecker state = new StateChecker();
    private final TemporalChecker temporal = new TemporalChecker();
    private final List<GuardChecker> fullOrder;
    private final List<GuardChecker> prefilterOrder;

    public GuardPipeline(Set<String> satisfied) {
        this.dependency = new DependencyChecker(satisfied);
        this.fullOrder = List.of(dependency, expiration, actor, location, state, temporal);
        // expiration is implied by temporal: a passed absolute deadline also fails "before:"
        this.prefilterOrder = List.of(dependency, temporal, state, actor, location);
    }

    /**
     * Runs every checker without short-circuiting and returns all diagnostics.
     */
    public List<FailureReason> evaluate(Unit unit, Context context) {
        List<FailureReason> reasons = new ArrayList<>();
        for (GuardChecker checker : fullOrder) {
            checker.check(unit, context).ifPresent(reasons::add);
        }
        return reasons;
    }

    /**
     * Cheap eligibility test used by the cascade: same verdict as {@link #evaluate} being empty.
     */
    public boolean prefilter(Unit unit, Context context) {
        for (GuardChecker checker : prefilterOrder) {
            if (!checker.matches(unit, context)) {
                return false;
            }
        }
        return true;
    }

    public List<GuardChecker> checkers() {
        return fullOrder;
    }
}
