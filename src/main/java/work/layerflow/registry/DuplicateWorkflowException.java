package work.layerflow.registry;

import work.layerflow.shared.EngineException;

public final class DuplicateWorkflowException extends EngineException {
    public DuplicateWorkflowException(String message) {
        super("duplicate_workflow", message);
    }
}
