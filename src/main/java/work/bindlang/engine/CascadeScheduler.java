package work.bindlang.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.bindlang.model.BoundResult;
import work.bindlang.model.Context;
import work.bindlang.model.StateChange;
import work.bindlang.model.Unit;

/**
 * Multi-round sweep over all registered units.
 * <p>
 * Each round walks the registry in insertion order. Units failing the cheap prefilter are
 * latent: never attempted, no audit entry. Eligible units go through the full bind. One-shot
 * units bound in this call are skipped in its later rounds; reusable units may bind again.
 * Declared state mutations of the round's bound units are applied afterwards in the same
 * order, so conflicting keys resolve last-write-wins. The sweep stops at the first round that
 * binds nothing, or at the round cap.
 */
final class CascadeScheduler {
    private static final Logger log = LoggerFactory.getLogger(CascadeScheduler.class);

    private final BindingEngine engine;

    CascadeScheduler(BindingEngine engine) {
        this.engine = engine;
    }

    SweepResult sweep(Context context, int maxRounds, boolean applyMutations) {
        if (maxRounds < 0) {
            throw new IllegalArgumentException("maxRounds must be >= 0");
        }
        List<BoundResult> results = new ArrayList<>();
        Set<String> consumed = new HashSet<>();
        Context current = context;
        int roundsUsed = 0;
        boolean converged = false;

        for (int round = 0; round < maxRounds; round++) {
            roundsUsed++;
            List<BoundResult> boundThisRound = new ArrayList<>();
            for (Unit unit : engine.registry().units()) {
                if (consumed.contains(unit.id())) continue;
                if (!engine.pipeline().prefilter(unit, current)) continue;
                var bound = engine.bind(unit, current);
                if (bound.isEmpty()) continue;
                boundThisRound.add(bound.get());
                if (!unit.isReusable()) {
                    consumed.add(unit.id());
                }
            }

            if (boundThisRound.isEmpty()) {
                converged = true;
                break;
            }
            log.debug("Round {} bound {}", round + 1, boundThisRound.stream().map(BoundResult::unitId).toList());

            if (applyMutations) {
                for (int i = 0; i < boundThisRound.size(); i++) {
                    var bound = boundThisRound.get(i);
                    var mutation = declaredMutation(bound);
                    if (mutation == null) continue;
                    List<StateChange> changes = new ArrayList<>();
                    for (var entry : mutation.entrySet()) {
                        String key = String.valueOf(entry.getKey());
                        changes.add(new StateChange(key, current.stateValue(key), entry.getValue()));
                        current = current.withState(key, entry.getValue());
                    }
                    boundThisRound.set(i, bound.withStateChanges(changes));
                    engine.audit().attachStateChanges(bound.unitId(), changes);
                }
            }
            results.addAll(boundThisRound);
        }

        log.info("Sweep finished after {} round(s): {} bound, converged={}", roundsUsed, results.size(), converged);
        return new SweepResult(results, current, roundsUsed, converged);
    }

    private Map<?, ?> declaredMutation(BoundResult bound) {
        var raw = bound.effect().get(engine.settings().mutationKey());
        return raw instanceof Map<?, ?> map ? map : null;
    }
}
