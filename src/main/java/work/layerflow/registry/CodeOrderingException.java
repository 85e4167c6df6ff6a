package work.layerflow.registry;

import work.layerflow.shared.EngineException;

/**
 * Raised when a task's highest input code is not below its lowest output code.
 */
public final class CodeOrderingException extends EngineException {
    public CodeOrderingException(String message) {
        super("code_ordering", message);
    }
}
