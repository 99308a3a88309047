package work.bindlang.guard;

import java.util.Optional;
import java.util.TreeSet;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;

public final class ActorChecker implements GuardChecker {
    @Override
    public boolean matches(Unit unit, Context context) {
        var guard = unit.guard();
        return !guard.hasActors() || guard.actors().contains(context.actor());
    }

    @Override
    public Optional<FailureReason> check(Unit unit, Context context) {
        if (matches(unit, context)) {
            return Optional.empty();
        }
        var expected = new TreeSet<>(unit.guard().actors());
        return Optional.of(new FailureReason(
            ConditionKind.ACTOR,
            expected,
            context.actor(),
            "actor: '" + context.actor() + "' not in " + expected
        ));
    }
}
