package work.layerflow.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.layerflow.config.ContextLoader;
import work.layerflow.config.EngineConfigLoader;
import work.layerflow.journal.FileRunJournal;
import work.layerflow.journal.RunJournal;
import work.layerflow.journal.RunLogFiles;
import work.layerflow.plan.DependencyResolver;
import work.layerflow.runtime.Orchestrator;
import work.layerflow.shared.RunTimestamps;
import work.layerflow.task.TaskCatalog;

/**
 * Public entry point for embedding the engine: loads the configuration, expands targets, builds the
 * context and runs the orchestrator, recording the run in the workspace journal.
 */
public final class LayerflowRunner {
    private static final Logger LOG = LoggerFactory.getLogger(LayerflowRunner.class);

    private final TaskCatalog catalog;
    private final RunInterceptor interceptor;

    public LayerflowRunner(TaskCatalog catalog) {
        this(catalog, RunInterceptor.NONE);
    }

    public LayerflowRunner(TaskCatalog catalog, RunInterceptor interceptor) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.interceptor = interceptor == null ? RunInterceptor.NONE : interceptor;
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        long timestamp = configuration.timestamp().orElseGet(RunTimestamps::now);
        Path workspace = configuration.workspace().toAbsolutePath().normalize();

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("workspace", workspace.toString());
        metadata.put("engine", configuration.engineConfig().toString());
        metadata.put("timestamp", timestamp);

        AutoCloseable level = RunLogFiles.applyLevel(configuration.logLevel());
        boolean fileLogging = configuration.fileLogging() && !configuration.dryRun();
        RunJournal journal = fileLogging ? new FileRunJournal(workspace) : RunJournal.NOOP;
        AutoCloseable runLog = () -> {};
        boolean journalStarted = false;
        try {
            prepareWorkspace(workspace);
            if (fileLogging) {
                runLog = RunLogFiles.attach(workspace, timestamp);
            }

            LOG.info("Setting up engine");
            var registry = new EngineConfigLoader(catalog).load(configuration.engineConfig());
            var targets = new DependencyResolver(registry)
                .expandTargets(configuration.targets(), configuration.includeDependencies());
            metadata.put("targets", targets);

            LOG.info("Setting up context");
            var context = ContextLoader.load(configuration.parameterFiles(), configuration.parameters());
            var plan = new RunPlan(workspace, targets, context);
            if (configuration.dryRun()) {
                return RunResult.planned(metadata, started);
            }

            if (interceptor != RunInterceptor.NONE) {
                LOG.info("Executing run interceptor");
                plan = interceptor.beforeRun(registry, plan);
                metadata.put("targets", plan.targets());
            }

            journal.reportStart(timestamp, plan.targets(), plan.context());
            journalStarted = true;
            LOG.info("Running the engine");
            new Orchestrator(registry, timestamp).run(plan.workspace(), plan.targets(), plan.context());
            journal.reportFinish(timestamp, true);
            metadata.put("status", "ok");
            return RunResult.success(metadata, started);
        } catch (Exception ex) {
            LOG.error("Run {} failed", timestamp, ex);
            if (journalStarted) {
                reportCrash(journal, timestamp, ex);
            }
            return RunResult.failure(ex, metadata, started);
        } finally {
            close(runLog, "run log", timestamp);
            close(level, "log level", timestamp);
        }
    }

    private static void prepareWorkspace(Path workspace) throws IOException {
        Files.createDirectories(workspace);
    }

    private static void reportCrash(RunJournal journal, long timestamp, Exception failure) {
        try {
            journal.reportFinish(timestamp, false);
        } catch (RuntimeException ex) {
            LOG.warn("Unable to journal the crash of run {}", timestamp, ex);
            failure.addSuppressed(ex);
        }
    }

    private static void close(AutoCloseable handle, String what, long timestamp) {
        try {
            handle.close();
        } catch (Exception ex) {
            LOG.warn("Unable to close {} of {}", what, timestamp, ex);
        }
    }
}
