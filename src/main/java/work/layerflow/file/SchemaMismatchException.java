package work.layerflow.file;

import work.layerflow.shared.EngineException;

/**
 * Raised when tabular content does not line up with the schema of its spec.
 */
public final class SchemaMismatchException extends EngineException {
    public SchemaMismatchException(String message) {
        super("schema_mismatch", message);
    }
}
