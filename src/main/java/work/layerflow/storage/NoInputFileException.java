package work.layerflow.storage;

import work.layerflow.shared.EngineException;

/**
 * Raised when the workspace holds no version of a code that has to be read.
 */
public final class NoInputFileException extends EngineException {
    public NoInputFileException(String message) {
        super("no_input_file", message);
    }
}
