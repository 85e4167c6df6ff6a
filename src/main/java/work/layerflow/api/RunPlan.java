package work.layerflow.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What is about to be handed to the orchestrator: workspace, expanded targets and the run context.
 */
public record RunPlan(Path workspace, List<Integer> targets, Map<String, Object> context) {
    public RunPlan {
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(targets, "targets");
        Objects.requireNonNull(context, "context");
    }

    public RunPlan withTargets(List<Integer> newTargets) {
        return new RunPlan(workspace, newTargets, context);
    }

    public RunPlan withContext(Map<String, Object> newContext) {
        return new RunPlan(workspace, targets, newContext);
    }
}
