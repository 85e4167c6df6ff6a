package work.layerflow.journal;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.layerflow.shared.RunTimestamps;

/**
 * Appends one pipe-separated row per run start and finish to {@code <workspace>/log/runs.log}.
 */
public final class FileRunJournal implements RunJournal {
    static final String HEADER = "run_id|timestamp|status|targets|params";

    private final Path runsLog;

    public FileRunJournal(Path workspace) {
        this.runsLog = RunLogFiles.logDirectory(workspace).resolve("runs.log");
    }

    public Path runsLog() {
        return runsLog;
    }

    @Override
    public void reportStart(long timestamp, List<Integer> targets, Map<String, Object> params) {
        var targetList = targets.stream().map(String::valueOf).collect(Collectors.joining(" "));
        var paramList = params.entrySet().stream()
            .filter(entry -> entry.getValue() instanceof String)
            .map(entry -> entry.getKey() + "=" + ((String) entry.getValue()).replace(' ', '_'))
            .collect(Collectors.joining(" "));
        append(String.join("|", Long.toString(timestamp), RunTimestamps.display(timestamp), "START", targetList, paramList));
    }

    @Override
    public void reportFinish(long timestamp, boolean success) {
        var status = success ? "FINISH" : "CRASH";
        append(String.join("|", Long.toString(timestamp), RunTimestamps.display(LocalDateTime.now()), status, "", "", ""));
    }

    private void append(String row) {
        try {
            Files.createDirectories(runsLog.getParent());
            if (!Files.isRegularFile(runsLog)) {
                Files.writeString(runsLog, HEADER + "\n", StandardCharsets.UTF_8);
            }
            Files.writeString(runsLog, row + "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write run journal " + runsLog, ex);
        }
    }
}
