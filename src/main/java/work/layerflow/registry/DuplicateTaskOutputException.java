package work.layerflow.registry;

import work.layerflow.shared.EngineException;

/**
 * Raised when two tasks claim the same output code.
 */
public final class DuplicateTaskOutputException extends EngineException {
    public DuplicateTaskOutputException(String message) {
        super("duplicate_task_output", message);
    }
}
