package work.layerflow.cli;

import picocli.CommandLine;
import work.layerflow.task.TaskCatalog;

/**
 * Entry point for the {@code java -jar} distribution. Tasks are discovered through
 * {@link work.layerflow.task.TaskProvider} service registrations on the class path.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(execute(TaskCatalog.loadProviders(), args));
    }

    /**
     * Runs the command line against an explicit catalog, for host programs that register tasks themselves.
     */
    public static int execute(TaskCatalog catalog, String... args) {
        return commandLine(catalog).execute(args);
    }

    static CommandLine commandLine(TaskCatalog catalog) {
        return new CommandLine(new LayerflowCommand(catalog))
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
