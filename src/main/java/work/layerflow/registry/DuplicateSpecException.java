package work.layerflow.registry;

import work.layerflow.shared.EngineException;

public final class DuplicateSpecException extends EngineException {
    public DuplicateSpecException(String message) {
        super("duplicate_spec", message);
    }
}
