package work.bindlang.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.bindlang.engine.EngineSettings;
import work.bindlang.export.ExportFormat;

/**
 * Immutable configuration for one scenario run. {@code scenarioPath} may be {@code null} when the
 * scenario is handed to the runner already loaded.
 */
public record ScenarioRunConfiguration(
    Path scenarioPath,
    EngineSettings settings,
    Optional<Path> auditOut,
    ExportFormat auditFormat,
    Optional<Path> ledgerOut,
    List<String> explain,
    LogLevel logLevel
) {
    public ScenarioRunConfiguration {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(auditOut, "auditOut");
        Objects.requireNonNull(auditFormat, "auditFormat");
        Objects.requireNonNull(ledgerOut, "ledgerOut");
        explain = explain == null ? List.of() : List.copyOf(explain);
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path scenarioPath;
        private EngineSettings settings = EngineSettings.defaults();
        private Optional<Path> auditOut = Optional.empty();
        private ExportFormat auditFormat = ExportFormat.JSONL;
        private Optional<Path> ledgerOut = Optional.empty();
        private List<String> explain = List.of();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder scenarioPath(Path scenarioPath) {
            this.scenarioPath = scenarioPath;
            return this;
        }

        public Builder settings(EngineSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder auditOut(Path auditOut) {
            this.auditOut = Optional.ofNullable(auditOut);
            return this;
        }

        public Builder auditFormat(ExportFormat auditFormat) {
            this.auditFormat = auditFormat;
            return this;
        }

        public Builder ledgerOut(Path ledgerOut) {
            this.ledgerOut = Optional.ofNullable(ledgerOut);
            return this;
        }

        public Builder explain(List<String> explain) {
            this.explain = explain;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ScenarioRunConfiguration build() {
            return new ScenarioRunConfiguration(
                scenarioPath,
                settings,
                auditOut,
                auditFormat,
                ledgerOut,
                explain,
                logLevel
            );
        }
    }
}
