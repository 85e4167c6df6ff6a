package work.layerflow.cli;

import picocli.CommandLine;
import work.layerflow.shared.EngineException;

/**
 * Prints one line per failure; the stack trace only with {@code -Dlayerflow.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof EngineException engineException) {
            message = "[" + engineException.code() + "] " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("layerflow.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
