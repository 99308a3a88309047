package work.bindlang.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.bindlang.audit.AuditSink;
import work.bindlang.audit.JsonFileSink;
import work.bindlang.audit.JsonlFileSink;
import work.bindlang.audit.MultiplexAuditSink;
import work.bindlang.audit.Slf4jAuditSink;
import work.bindlang.engine.BindingEngine;
import work.bindlang.engine.EngineSettings;
import work.bindlang.export.ExportFormat;
import work.bindlang.export.LedgerExporter;
import work.bindlang.model.Unit;
import work.bindlang.orchestration.ActorSequenceRunner;

/**
 * Public entry point for running scenario files: registers the units, drives the engine in the
 * scenario's mode and reports what bound.
 */
public final class ScenarioRunner {
    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);

    public RunResult run(ScenarioRunConfiguration configuration) {
        var started = Instant.now();
        if (configuration.scenarioPath() == null) {
            throw new IllegalArgumentException("scenarioPath is required to load a scenario");
        }
        try {
            var scenario = ScenarioLoader.load(configuration.scenarioPath());
            return execute(scenario, configuration, started);
        } catch (RuntimeException ex) {
            log.debug("Scenario {} failed", configuration.scenarioPath(), ex);
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("scenario", configuration.scenarioPath().toString());
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    /**
     * Runs an already loaded scenario with default settings and no file output.
     */
    public RunResult run(Scenario scenario) {
        return run(scenario, ScenarioRunConfiguration.builder().build());
    }

    /**
     * Runs an already loaded scenario; {@code scenarioPath} of the configuration is ignored.
     */
    public RunResult run(Scenario scenario, ScenarioRunConfiguration configuration) {
        return execute(scenario, configuration, Instant.now());
    }

    private RunResult execute(Scenario scenario, ScenarioRunConfiguration configuration, Instant started) {
        List<String> activations = new ArrayList<>();
        var engine = BindingEngine.builder()
            .settings(configuration.settings())
            .auditSink(sinkFor(configuration))
            .onActivated((unit, context, bound) -> activations.add(unit.id()))
            .build();

        var metadata = new LinkedHashMap<String, Object>();
        try (engine) {
            for (Unit unit : scenario.units()) {
                engine.register(unit);
            }
            metadata.put("scenario", scenario.name());
            metadata.put("mode", scenario.mode().name().toLowerCase(Locale.ROOT));
            metadata.putAll(drive(engine, scenario, configuration.settings()));
            metadata.put("bound", List.copyOf(activations));
            metadata.put("satisfied", List.copyOf(engine.satisfiedIds()));
            metadata.put("failureStats", engine.audit().stats());
            metadata.put("explanations", explanations(engine, scenario, configuration.explain()));
            configuration.ledgerOut().ifPresent(path -> LedgerExporter.export(engine.ledger(), path, ExportFormat.JSON));
        }
        log.info("Scenario {} bound {} unit(s)", scenario.name(), activations.size());
        return RunResult.success(metadata, started);
    }

    private Map<String, Object> drive(BindingEngine engine, Scenario scenario, EngineSettings settings) {
        var outcome = new LinkedHashMap<String, Object>();
        switch (scenario.mode()) {
            case TURNS -> {
                var context = scenario.context();
                var result = new ActorSequenceRunner(engine)
                    .run(scenario.turns(), context.state(), context.timestamp());
                outcome.put("turns", scenario.turns().size());
                outcome.put("finalState", result.finalState());
            }
            case EVOLVE -> {
                var result = engine.evolveUntilConverged(scenario.context());
                outcome.put("turnsUsed", result.turnsUsed());
                outcome.put("converged", result.converged());
                outcome.put("finalState", result.finalContext().state());
            }
            default -> {
                var result = engine.sweep(scenario.context(), settings.maxRounds(), settings.applyMutations());
                outcome.put("roundsUsed", result.roundsUsed());
                outcome.put("converged", result.converged());
                outcome.put("finalState", result.finalContext().state());
            }
        }
        return outcome;
    }

    private Map<String, String> explanations(BindingEngine engine, Scenario scenario, List<String> requested) {
        var ids = new ArrayList<String>(requested);
        if (ids.isEmpty()) {
            for (Unit unit : scenario.units()) {
                if (!engine.isSatisfied(unit.id())) {
                    ids.add(unit.id());
                }
            }
        }
        var explanations = new LinkedHashMap<String, String>();
        for (String id : ids) {
            explanations.put(id, engine.explain(id));
        }
        return explanations;
    }

    private AuditSink sinkFor(ScenarioRunConfiguration configuration) {
        var logSink = new Slf4jAuditSink();
        return configuration.auditOut()
            .<AuditSink>map(path -> new MultiplexAuditSink(
                configuration.auditFormat() == ExportFormat.JSON ? new JsonFileSink(path) : new JsonlFileSink(path, 10, false),
                logSink
            ))
            .orElse(logSink);
    }
}
