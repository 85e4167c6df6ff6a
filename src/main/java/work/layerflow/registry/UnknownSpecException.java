package work.layerflow.registry;

import work.layerflow.shared.EngineException;

public final class UnknownSpecException extends EngineException {
    public UnknownSpecException(String message) {
        super("unknown_spec", message);
    }
}
