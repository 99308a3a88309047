package work.bindlang.guard;

import java.util.Optional;
import java.util.TreeSet;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Context;
import work.bindlang.model.FailureReason;
import work.bindlang.model.Unit;

public final class LocationChecker implements GuardChecker {
    @Override
    public boolean matches(Unit unit, Context context) {
        var guard = unit.guard();
        return !guard.hasLocations() || guard.locations().contains(context.location());
    }

    @Override
    public Optional<FailureReason> check(Unit unit, Context context) {
        if (matches(unit, context)) {
            return Optional.empty();
        }
        var expected = new TreeSet<>(unit.guard().locations());
        return Optional.of(new FailureReason(
            ConditionKind.LOCATION,
            expected,
            context.location(),
            "location: '" + context.location() + "' not in " + expected
        ));
    }
}
