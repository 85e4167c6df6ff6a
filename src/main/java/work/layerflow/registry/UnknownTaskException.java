package work.layerflow.registry;

import work.layerflow.shared.EngineException;

/**
 * Raised when a target code has no producing task.
 */
public final class UnknownTaskException extends EngineException {
    public UnknownTaskException(String message) {
        super("unknown_task", message);
    }
}
