package work.layerflow.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.layerflow.registry.EngineRegistry;

/**
 * Expands target requests (codes and workflow names) into the list of codes to build.
 * <p>
 * With dependencies the result is sorted ascending, which is a valid execution order because every task's
 * outputs are numerically above its inputs. Without dependencies the expanded requests are returned as given,
 * repeats included.
 */
public final class DependencyResolver {
    private static final Logger LOG = LoggerFactory.getLogger(DependencyResolver.class);

    private final EngineRegistry registry;

    public DependencyResolver(EngineRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public List<Integer> expandTargets(List<String> requests, boolean includeDependencies) {
        List<Integer> seeds = new ArrayList<>();
        for (String request : requests) {
            var workflow = registry.workflow(request);
            if (workflow.isPresent()) {
                seeds.addAll(workflow.get());
            } else {
                seeds.add(parseCode(request));
            }
        }
        if (!includeDependencies) {
            return seeds;
        }
        return addDependencies(seeds);
    }

    private List<Integer> addDependencies(List<Integer> seeds) {
        Set<Integer> seedCodes = new HashSet<>(seeds);
        Deque<Integer> pending = new ArrayDeque<>(seeds);
        Set<Integer> closure = new LinkedHashSet<>();
        while (!pending.isEmpty()) {
            int code = pending.pollLast();
            if (!seedCodes.contains(code) && !registry.hasProducer(code)) {
                LOG.debug("Code {} has no producing task, expecting it in the workspace", code);
                continue;
            }
            if (!closure.add(code)) {
                continue;
            }
            var task = registry.producerOf(code);
            for (int dependency : task.inputCodes()) {
                if (closure.contains(dependency) || pending.contains(dependency)) {
                    continue;
                }
                pending.addFirst(dependency);
            }
        }
        List<Integer> ordered = new ArrayList<>(closure);
        ordered.sort(null);
        LOG.debug("Expanded {} into {}", seeds, ordered);
        return ordered;
    }

    private static int parseCode(String request) {
        if (request == null) {
            throw new InvalidTargetException("Target must not be null", null);
        }
        try {
            return Integer.parseInt(request.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidTargetException("Target " + request + " is neither a workflow nor a data file code", ex);
        }
    }
}
