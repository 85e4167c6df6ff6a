package work.layerflow.task;

/**
 * Service-provider hook used by {@link TaskCatalog#loadProviders()}; list implementations in
 * {@code META-INF/services/work.layerflow.task.TaskProvider}.
 */
public interface TaskProvider {
    void contribute(TaskCatalog catalog);
}
