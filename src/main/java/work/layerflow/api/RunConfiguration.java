package work.layerflow.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.layerflow.shared.RunTimestamps;

/**
 * Immutable configuration of one engine run.
 */
public record RunConfiguration(
    Path workspace,
    Path engineConfig,
    List<String> targets,
    boolean includeDependencies,
    List<Path> parameterFiles,
    List<String> parameters,
    Optional<Long> timestamp,
    boolean fileLogging,
    LogLevel logLevel,
    boolean dryRun
) {
    public RunConfiguration {
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(engineConfig, "engineConfig");
        Objects.requireNonNull(targets, "targets");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(logLevel, "logLevel");
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("At least one target is required.");
        }
        timestamp.ifPresent(RunTimestamps::toDateTime);
        targets = List.copyOf(targets);
        parameterFiles = parameterFiles == null ? List.of() : List.copyOf(parameterFiles);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path workspace;
        private Path engineConfig = Path.of("engine.yaml");
        private List<String> targets = List.of();
        private boolean includeDependencies;
        private List<Path> parameterFiles = List.of();
        private List<String> parameters = List.of();
        private Optional<Long> timestamp = Optional.empty();
        private boolean fileLogging = true;
        private LogLevel logLevel = LogLevel.INFO;
        private boolean dryRun;

        public Builder workspace(Path workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder engineConfig(Path engineConfig) {
            this.engineConfig = engineConfig;
            return this;
        }

        public Builder targets(List<String> targets) {
            this.targets = targets;
            return this;
        }

        public Builder includeDependencies(boolean includeDependencies) {
            this.includeDependencies = includeDependencies;
            return this;
        }

        public Builder parameterFiles(List<Path> parameterFiles) {
            this.parameterFiles = parameterFiles;
            return this;
        }

        public Builder parameters(List<String> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder timestamp(Optional<Long> timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = Optional.of(timestamp);
            return this;
        }

        public Builder fileLogging(boolean fileLogging) {
            this.fileLogging = fileLogging;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                workspace,
                engineConfig,
                targets,
                includeDependencies,
                parameterFiles,
                parameters,
                timestamp,
                fileLogging,
                logLevel,
                dryRun
            );
        }
    }
}
