package work.layerflow.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.layerflow.shared.EngineException;

/**
 * Outcome of a {@link LayerflowRunner} execution. A failure records the message and the engine error code
 * ({@code task_failed} for exceptions raised by task code) in the metadata.
 */
public record RunResult(Status status, Map<String, Object> metadata, Optional<Exception> error, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, metadata, Optional.empty(), startedAt, Instant.now());
    }

    public static RunResult failure(Exception error, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        var message = error.getMessage();
        meta.putIfAbsent("error", message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
        meta.putIfAbsent("errorCode", error instanceof EngineException engineError ? engineError.code() : "task_failed");
        return new RunResult(Status.FAILURE, meta, Optional.of(error), startedAt, Instant.now());
    }

    public static RunResult planned(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.PLANNED, metadata, Optional.empty(), startedAt, Instant.now());
    }

    /**
     * Rethrows the exception that failed the run, if any.
     */
    public RunResult rethrowIfFailed() throws Exception {
        if (error.isPresent()) {
            throw error.get();
        }
        return this;
    }

    /**
     * Number of codes the run built, or planned to build; zero when it failed before target expansion.
     */
    public int targetCount() {
        return metadata.get("targets") instanceof List<?> targets ? targets.size() : 0;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("exitCode", status.exitCode());
        serializable.put("targetCount", targetCount());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        PLANNED(0);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
