package work.bindlang.engine;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.bindlang.audit.AuditSink;
import work.bindlang.audit.AuditTrail;
import work.bindlang.audit.NullAuditSink;
import work.bindlang.guard.GuardPipeline;
import work.bindlang.lifecycle.Transition;
import work.bindlang.lifecycle.TransitionLedger;
import work.bindlang.lifecycle.UnitState;
import work.bindlang.model.Attempt;
import work.bindlang.model.BoundResult;
import work.bindlang.model.ConditionKind;
import work.bindlang.model.Context;
import work.bindlang.model.Unit;

/**
 * Owns the registry, satisfied-id set, transition ledger and attempt log, and binds units
 * against contexts.
 * <p>
 * Single-threaded: callers sharing an engine must serialize access themselves.
 */
public final class BindingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BindingEngine.class);
    private static final double DEFAULT_WEIGHT = 1.0;

    private final UnitRegistry registry = new UnitRegistry();
    private final Set<String> satisfied = new LinkedHashSet<>();
    private final AuditTrail audit = new AuditTrail();
    private final TransitionLedger ledger;
    private final GuardPipeline pipeline;
    private final CascadeScheduler scheduler;
    private final EngineSettings settings;
    private final ActivationListener listener;
    private final Clock clock;
    private AuditSink sink;

    private BindingEngine(Builder builder) {
        this.settings = builder.settings;
        this.listener = builder.listener;
        this.clock = builder.clock;
        this.sink = builder.sink;
        this.ledger = new TransitionLedger(clock);
        this.pipeline = new GuardPipeline(Collections.unmodifiableSet(satisfied));
        this.scheduler = new CascadeScheduler(this);
    }

    public static BindingEngine create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers (or replaces) a unit and records its Created to Dormant transition.
     *
     * @throws CircularDependencyException if the unit closes a dependency cycle; nothing is changed
     */
    public void register(Unit unit) {
        Objects.requireNonNull(unit, "unit");
        try {
            boolean added = registry.register(unit);
            log.debug("{} unit {}", added ? "Registered" : "Replaced", unit.id());
        } catch (CircularDependencyException ex) {
            log.warn("Rejected unit {}: {}", unit.id(), ex.getMessage());
            throw ex;
        }
        ledger.record(unit.id(), UnitState.CREATED, UnitState.DORMANT, "Registered");
    }

    /**
     * Evaluates {@code unit} against {@code context} through every guard checker.
     * Guard mismatches are recorded as a failed attempt and yield an empty result.
     */
    public Optional<BoundResult> bind(Unit unit, Context context) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(context, "context");
        var now = LocalDateTime.now(clock);
        var reasons = pipeline.evaluate(unit, context);

        if (!reasons.isEmpty()) {
            var attempt = Attempt.failure(unit.id(), now, context, reasons);
            recordAttempt(attempt);
            if (attempt.hasReason(ConditionKind.EXPIRED)) {
                log.debug("Unit {} expired", unit.id());
                ledger.record(unit.id(), UnitState.DORMANT, UnitState.EXPIRED, "Deadline passed");
            }
            return Optional.empty();
        }

        var bound = new BoundResult(
            unit.id(),
            unit.type(),
            unit.payload(),
            weightOf(unit),
            now,
            context.snapshot(),
            null
        );
        satisfied.add(unit.id());
        ledger.record(unit.id(), UnitState.DORMANT, UnitState.ACTIVATED, "Binding success");
        recordAttempt(Attempt.success(unit.id(), now, context));
        log.debug("Unit {} bound (weight {})", unit.id(), bound.weight());
        if (listener != null) {
            listener.onActivated(unit, context, bound);
        }
        return Optional.of(bound);
    }

    /**
     * Binds the given registered ids in order, returning the ones that bound.
     *
     * @throws UnknownUnitException if any id is not registered; no attempt is made in that case
     */
    public List<BoundResult> bindMany(List<String> unitIds, Context context) {
        var units = unitIds.stream().map(registry::require).toList();
        List<BoundResult> results = new ArrayList<>();
        for (Unit unit : units) {
            bind(unit, context).ifPresent(results::add);
        }
        return results;
    }

    public SweepResult sweep(Context context) {
        return sweep(context, settings.maxRounds(), settings.applyMutations());
    }

    public SweepResult sweep(Context context, int maxRounds, boolean applyMutations) {
        Objects.requireNonNull(context, "context");
        return scheduler.sweep(context, maxRounds, applyMutations);
    }

    public ConvergenceResult evolveUntilConverged(Context context) {
        return evolveUntilConverged(context, settings.maxTurns(), null);
    }

    /**
     * Repeats whole sweeps (with mutations applied) until a sweep satisfies no new unit id or
     * {@code maxTurns} is reached. {@code hook}, when given, runs after every sweep that made
     * progress and may return an updated context.
     */
    public ConvergenceResult evolveUntilConverged(Context context, int maxTurns, TurnHook hook) {
        Objects.requireNonNull(context, "context");
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be >= 1");
        }
        Context current = context;
        int turnsUsed = 0;
        boolean converged = false;
        for (int turn = 0; turn < maxTurns; turn++) {
            turnsUsed++;
            int before = satisfied.size();
            current = sweep(current, settings.maxRounds(), true).finalContext();
            if (satisfied.size() == before) {
                converged = true;
                break;
            }
            if (hook != null) {
                current = Objects.requireNonNull(hook.onTurnComplete(this, current, turn), "hook returned null context");
            }
        }
        log.info("Evolution stopped after {} turn(s), converged={}", turnsUsed, converged);
        return new ConvergenceResult(current, turnsUsed, converged);
    }

    public List<Transition> ledger() {
        return ledger.entries();
    }

    public List<Transition> ledger(String unitId) {
        return ledger.entries(unitId);
    }

    public String explain(String unitId) {
        return audit.explain(unitId);
    }

    public AuditTrail audit() {
        return audit;
    }

    public UnitRegistry registry() {
        return registry;
    }

    public Set<String> satisfiedIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(satisfied));
    }

    public boolean isSatisfied(String unitId) {
        return satisfied.contains(unitId);
    }

    public EngineSettings settings() {
        return settings;
    }

    public void flush() {
        sink.flush();
    }

    /**
     * Closes the audit sink once; later attempts are kept in memory only.
     */
    @Override
    public void close() {
        var current = sink;
        sink = NullAuditSink.INSTANCE;
        current.close();
    }

    GuardPipeline pipeline() {
        return pipeline;
    }

    private void recordAttempt(Attempt attempt) {
        audit.record(attempt);
        sink.write(attempt);
    }

    private double weightOf(Unit unit) {
        Object raw = unit.payload().get(settings.weightKey());
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                log.warn("Unit {} has non-numeric weight '{}', using {}", unit.id(), text, DEFAULT_WEIGHT);
            }
        }
        return DEFAULT_WEIGHT;
    }

    public static final class Builder {
        private EngineSettings settings = EngineSettings.defaults();
        private AuditSink sink = NullAuditSink.INSTANCE;
        private ActivationListener listener;
        private Clock clock = Clock.systemDefaultZone();

        public Builder settings(EngineSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder auditSink(AuditSink sink) {
            this.sink = sink == null ? NullAuditSink.INSTANCE : sink;
            return this;
        }

        public Builder onActivated(ActivationListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public BindingEngine build() {
            return new BindingEngine(this);
        }
    }
}
