package work.layerflow.api;

import work.layerflow.registry.EngineRegistry;

/**
 * Hook invoked after setup and just before the orchestrator runs; may return an adjusted plan.
 */
@FunctionalInterface
public interface RunInterceptor {
    RunInterceptor NONE = (registry, plan) -> plan;

    RunPlan beforeRun(EngineRegistry registry, RunPlan plan) throws Exception;
}
