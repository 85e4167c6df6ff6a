package work.layerflow.plan;

import work.layerflow.shared.EngineException;

/**
 * Raised when a target request is neither a workflow name nor an integer code.
 */
public final class InvalidTargetException extends EngineException {
    public InvalidTargetException(String message, Throwable cause) {
        super("invalid_target", message, cause);
    }
}
