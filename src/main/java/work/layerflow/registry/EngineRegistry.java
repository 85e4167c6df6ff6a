package work.layerflow.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.layerflow.spec.FileSpec;
import work.layerflow.task.Task;

/**
 * Holds file specs, tasks (keyed by output code) and workflows. Filled once during setup and
 * read-only while a run executes.
 */
public final class EngineRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(EngineRegistry.class);

    private final Map<Integer, FileSpec> specs = new HashMap<>();
    private final Map<Integer, Task> tasksByOutput = new HashMap<>();
    private final Map<String, List<Integer>> workflows = new LinkedHashMap<>();

    public EngineRegistry registerFileSpec(FileSpec spec) {
        if (specs.containsKey(spec.code())) {
            throw new DuplicateSpecException("File specification " + spec.code() + " already registered");
        }
        LOG.debug("Registering file spec {} ({})", spec.code(), spec.name());
        specs.put(spec.code(), spec);
        return this;
    }

    public EngineRegistry registerTask(Task task) {
        List<Integer> inputs = List.copyOf(task.inputCodes());
        List<Integer> outputs = List.copyOf(task.outputCodes());
        for (int code : outputs) {
            if (tasksByOutput.containsKey(code)) {
                throw new DuplicateTaskOutputException("Task with output " + code + " already registered");
            }
        }

        if (!inputs.isEmpty() && !outputs.isEmpty()) {
            int maxInput = Collections.max(inputs);
            int minOutput = Collections.min(outputs);
            if (maxInput >= minOutput) {
                throw new CodeOrderingException(
                    "Input code " + maxInput + " not smaller than output code " + minOutput + " in task " + task.describe()
                );
            }
        }

        requireSpecs(inputs, task);
        requireSpecs(outputs, task);

        LOG.debug("Registering task {}", task.describe());
        for (int code : outputs) {
            tasksByOutput.put(code, task);
        }
        return this;
    }

    public EngineRegistry registerWorkflow(String name, List<Integer> codes) {
        if (workflows.containsKey(name)) {
            throw new DuplicateWorkflowException("Workflow " + name + " already registered");
        }
        LOG.debug("Registering workflow {} with targets {}", name, codes);
        workflows.put(name, List.copyOf(codes));
        return this;
    }

    public FileSpec spec(int code) {
        var spec = specs.get(code);
        if (spec == null) {
            throw new UnknownSpecException("No file specification registered for code " + code);
        }
        return spec;
    }

    public boolean hasProducer(int code) {
        return tasksByOutput.containsKey(code);
    }

    public Task producerOf(int code) {
        var task = tasksByOutput.get(code);
        if (task == null) {
            throw new UnknownTaskException("No registered task that can create target " + code);
        }
        return task;
    }

    public Optional<List<Integer>> workflow(String name) {
        return Optional.ofNullable(workflows.get(name));
    }

    public Collection<FileSpec> specs() {
        return Collections.unmodifiableCollection(specs.values());
    }

    public Map<String, List<Integer>> workflows() {
        return Collections.unmodifiableMap(workflows);
    }

    private void requireSpecs(List<Integer> codes, Task task) {
        for (int code : codes) {
            if (!specs.containsKey(code)) {
                throw new UnknownSpecException("Unregistered spec " + code + " referenced in task " + task.describe());
            }
        }
    }
}
