package work.layerflow.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.layerflow.file.DataFile;
import work.layerflow.file.FileIntent;
import work.layerflow.registry.EngineRegistry;
import work.layerflow.storage.VersionedFileResolver;
import work.layerflow.task.Task;

/**
 * Runs the tasks producing a list of target codes, in the given order, each task at most once per run.
 * <p>
 * Outputs of a task are published under their final names once it returns. When a task fails its unpublished
 * outputs are deleted and the failure propagates; outputs of earlier tasks stay in the workspace.
 */
public final class Orchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(Orchestrator.class);

    private final EngineRegistry registry;
    private final VersionedFileResolver files;
    private final long runTimestamp;

    public Orchestrator(EngineRegistry registry, long runTimestamp) {
        this(registry, new VersionedFileResolver(registry), runTimestamp);
    }

    public Orchestrator(EngineRegistry registry, VersionedFileResolver files, long runTimestamp) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.files = Objects.requireNonNull(files, "files");
        this.runTimestamp = runTimestamp;
    }

    public long runTimestamp() {
        return runTimestamp;
    }

    /**
     * Runs the producers of {@code targets}.
     *
     * @param context shared with every task of this run; {@code null} starts from an empty map
     * @return the context after the last task ran
     */
    public Map<String, Object> run(Path workspace, List<Integer> targets, Map<String, Object> context) throws Exception {
        Map<String, Object> shared = context == null ? new HashMap<>() : context;
        LOG.debug("Context has {} items", shared.size());
        shared.forEach((key, value) -> LOG.debug("* {}: {}", key, value));

        Set<Task> completed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int target : targets) {
            var task = registry.producerOf(target);
            if (completed.contains(task)) {
                LOG.debug("Target {} already built by task {}", target, task.describe());
                continue;
            }
            LOG.info("Building target {} ({}) by running task {}", target, registry.spec(target).name(), task.describe());
            Map<Integer, DataFile> inputs = new LinkedHashMap<>();
            for (int code : task.inputCodes()) {
                var file = files.open(workspace, code, FileIntent.READ, runTimestamp);
                LOG.debug("Input file {} is {}", code, file.path());
                inputs.put(code, file);
            }
            Map<Integer, DataFile> outputs = new LinkedHashMap<>();
            for (int code : task.outputCodes()) {
                var file = files.open(workspace, code, FileIntent.WRITE, runTimestamp);
                LOG.debug("Output file {} is {}", code, file.path());
                outputs.put(code, file);
            }
            try {
                task.run(inputs, outputs, shared);
            } catch (Exception ex) {
                discard(outputs.values(), ex);
                throw ex;
            }
            for (var output : outputs.values()) {
                if (!output.publish()) {
                    LOG.warn("Task {} wrote nothing for output {}", task.describe(), output.spec().code());
                }
            }
            completed.add(task);
        }
        return shared;
    }

    private static void discard(Collection<DataFile> outputs, Exception failure) {
        for (var output : outputs) {
            try {
                output.discard();
            } catch (IOException ex) {
                LOG.warn("Unable to delete unfinished output {}", output.partialPath(), ex);
                failure.addSuppressed(ex);
            }
        }
    }
}
