package work.layerflow.config;

import work.layerflow.shared.EngineException;

/**
 * Raised when an engine configuration or parameter file cannot be read or is malformed.
 */
public final class EngineConfigException extends EngineException {
    public EngineConfigException(String message) {
        super("invalid_config", message);
    }

    public EngineConfigException(String message, Throwable cause) {
        super("invalid_config", message, cause);
    }
}
