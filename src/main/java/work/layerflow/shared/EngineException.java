package work.layerflow.shared;

/**
 * Base type for every failure raised by the engine itself. Carries a stable machine-readable code.
 */
public class EngineException extends RuntimeException {
    private final String code;

    public EngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public EngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
