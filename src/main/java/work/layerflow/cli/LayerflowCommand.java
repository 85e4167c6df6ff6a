package work.layerflow.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine;
import work.layerflow.api.LayerflowRunner;
import work.layerflow.api.LogLevel;
import work.layerflow.api.RunConfiguration;
import work.layerflow.api.RunResult;
import work.layerflow.task.TaskCatalog;

@CommandLine.Command(
    name = "layerflow",
    description = "Build data file targets by running the tasks that produce them.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LayerflowCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--dir",
        required = true,
        description = "Workspace directory holding the data files."
    )
    private String dir;

    @CommandLine.Option(
        names = "--targets",
        required = true,
        arity = "1..*",
        description = "Data file codes and workflow names to build."
    )
    private List<String> targets = new ArrayList<>();

    @CommandLine.Option(
        names = "--deps",
        description = "Add upstream targets (resolve dependencies)."
    )
    private boolean dependencies;

    @CommandLine.Option(
        names = "--engine",
        defaultValue = "engine.yaml",
        description = "Engine configuration file in YAML format."
    )
    private String engine;

    @CommandLine.Option(
        names = "--conf",
        arity = "1..*",
        description = "Parameter file(s) in TOML format."
    )
    private List<String> conf = new ArrayList<>();

    @CommandLine.Option(
        names = "--params",
        arity = "1..*",
        paramLabel = "KEY=VALUE",
        description = "Additional parameters, optionally prefixed with a section (section.key=value)."
    )
    private List<String> params = new ArrayList<>();

    @CommandLine.Option(
        names = "--timestamp",
        paramLabel = "yyyyMMddHHmmss",
        description = "Run timestamp used to version outputs (default: now)."
    )
    private Long timestamp;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--no-file-log",
        description = "Do not write the run journal and run log under <dir>/log."
    )
    private boolean noFileLog;

    @CommandLine.Option(
        names = "--dry-run",
        description = "Only print the expanded target list."
    )
    private boolean dryRun;

    private final TaskCatalog catalog;

    LayerflowCommand(TaskCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public Integer call() {
        if (targets == null || targets.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one --targets value is required.");
        }

        RunConfiguration configuration = RunConfiguration.builder()
            .workspace(toPath(dir))
            .engineConfig(toPath(engine))
            .targets(targets)
            .includeDependencies(dependencies)
            .parameterFiles(conf == null ? List.of() : conf.stream().map(LayerflowCommand::toPath).collect(Collectors.toList()))
            .parameters(params == null ? List.of() : params)
            .timestamp(Optional.ofNullable(timestamp))
            .fileLogging(!noFileLog)
            .logLevel(resolveLogLevel())
            .dryRun(dryRun)
            .build();

        RunResult result = new LayerflowRunner(catalog).run(configuration);
        PrintWriter out = spec.commandLine().getOut();
        out.println(result.toPrettyJson());
        out.flush();
        return result.status().exitCode();
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("LAYERFLOW_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }

    private static Path toPath(String value) {
        return Paths.get(value).toAbsolutePath().normalize();
    }
}
