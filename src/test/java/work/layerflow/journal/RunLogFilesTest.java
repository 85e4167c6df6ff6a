package work.layerflow.journal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import work.layerflow.api.LogLevel;

class RunLogFilesTest {
    private static final Logger LOG = LoggerFactory.getLogger(RunLogFilesTest.class);
    private static final long TIMESTAMP = 20170807101530L;

    @TempDir
    Path directory;

    @Test
    void levelIsRestoredOnClose() throws Exception {
        var root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        var before = root.getLevel();
        try (var level = RunLogFiles.applyLevel(LogLevel.TRACE)) {
            assertEquals(Level.TRACE, root.getLevel());
        }
        assertEquals(before, root.getLevel());
    }

    @Test
    void concurrentRunsKeepSeparateFiles() throws Exception {
        var first = directory.resolve("first");
        var second = directory.resolve("second");
        var failure = new AtomicReference<Exception>();

        try (var run = RunLogFiles.attach(first, TIMESTAMP)) {
            LOG.info("inside first run");
            var other = new Thread(() -> {
                try (var inner = RunLogFiles.attach(second, TIMESTAMP)) {
                    LOG.info("inside second run");
                } catch (Exception ex) {
                    failure.set(ex);
                }
            });
            other.start();
            other.join();
        }
        LOG.info("after both runs");

        assertNull(failure.get());
        assertNull(MDC.get(RunLogFiles.RUN_KEY));
        var firstLog = Files.readString(RunLogFiles.runLogFile(first, TIMESTAMP));
        var secondLog = Files.readString(RunLogFiles.runLogFile(second, TIMESTAMP));
        assertTrue(firstLog.contains("inside first run"), firstLog);
        assertFalse(firstLog.contains("inside second run"), firstLog);
        assertFalse(firstLog.contains("after both runs"), firstLog);
        assertTrue(secondLog.contains("inside second run"), secondLog);
        assertFalse(secondLog.contains("inside first run"), secondLog);
    }
}
