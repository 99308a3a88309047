package work.bindlang.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.bindlang.api.LogLevel;
import work.bindlang.api.RunResult;
import work.bindlang.api.ScenarioRunConfiguration;
import work.bindlang.api.ScenarioRunner;
import work.bindlang.engine.EngineSettings;
import work.bindlang.engine.EngineSettingsLoader;
import work.bindlang.export.ExportFormat;

@CommandLine.Command(
    name = "bind-run",
    description = "Register the units of a scenario file, bind them and print what activated.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class BindRunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--scenario"},
        required = true,
        description = "Scenario file (YAML or JSON)."
    )
    private Path scenario;

    @CommandLine.Option(
        names = "--config",
        description = "TOML engine settings ([cascade], [payload]).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--max-rounds",
        description = "Cascade round cap (overrides --config).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxRounds;

    @CommandLine.Option(
        names = "--no-mutations",
        description = "Do not apply state mutations between cascade rounds."
    )
    private boolean noMutations;

    @CommandLine.Option(
        names = "--audit-out",
        description = "Write every binding attempt to this file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path auditOut;

    @CommandLine.Option(
        names = "--audit-format",
        description = "Audit file format (json|jsonl).",
        defaultValue = "jsonl"
    )
    private String auditFormat;

    @CommandLine.Option(
        names = "--ledger-out",
        description = "Write the lifecycle transition ledger (JSON) to this file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path ledgerOut;

    @CommandLine.Option(
        names = "--explain",
        description = "Unit ids to explain (default: every unit left unbound).",
        arity = "1..*"
    )
    private List<String> explain = new ArrayList<>();

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        logLevel.apply();

        ScenarioRunConfiguration configuration = ScenarioRunConfiguration.builder()
            .scenarioPath(scenario)
            .settings(resolveSettings())
            .auditOut(auditOut)
            .auditFormat(resolveAuditFormat())
            .ledgerOut(ledgerOut)
            .explain(explain)
            .logLevel(logLevel)
            .build();

        RunResult result = new ScenarioRunner().run(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        return result.status().exitCode();
    }

    private EngineSettings resolveSettings() {
        EngineSettings base = config == null ? EngineSettings.defaults() : EngineSettingsLoader.load(config);
        var builder = base.toBuilder();
        if (maxRounds != null) {
            if (maxRounds < 0) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--max-rounds must be >= 0");
            }
            builder.maxRounds(maxRounds);
        }
        if (noMutations) {
            builder.applyMutations(false);
        }
        return builder.build();
    }

    private ExportFormat resolveAuditFormat() {
        try {
            return ExportFormat.from(auditFormat);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
