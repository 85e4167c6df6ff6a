package work.layerflow.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Named task factories. Engine configuration refers to tasks by these names.
 */
public final class TaskCatalog {
    private final Map<String, Supplier<? extends Task>> factories = new LinkedHashMap<>();

    public static TaskCatalog loadProviders() {
        return loadProviders(Thread.currentThread().getContextClassLoader());
    }

    public static TaskCatalog loadProviders(ClassLoader classLoader) {
        var catalog = new TaskCatalog();
        for (TaskProvider provider : ServiceLoader.load(TaskProvider.class, classLoader)) {
            provider.contribute(catalog);
        }
        return catalog;
    }

    public TaskCatalog register(String name, Supplier<? extends Task> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Task factory is required for " + name);
        }
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Task " + name + " already registered in catalog");
        }
        return this;
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public Task create(String name) {
        var factory = factories.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("No task named " + name + " in catalog " + factories.keySet());
        }
        Task task = factory.get();
        if (task == null) {
            throw new IllegalStateException("Factory for task " + name + " returned null");
        }
        return task;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
