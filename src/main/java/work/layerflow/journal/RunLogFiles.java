package work.layerflow.journal;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import work.layerflow.api.LogLevel;

/**
 * Per-run log file ({@code <workspace>/log/<timestamp>.log}) and root level handling on top of Logback.
 */
public final class RunLogFiles {
    public static final String RUN_KEY = "layerflowRun";
    static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss,SSS} %logger %level %msg%n";
    private static final Logger LOG = LoggerFactory.getLogger(RunLogFiles.class);

    private RunLogFiles() {}

    public static Path logDirectory(Path workspace) {
        return workspace.resolve("log");
    }

    public static Path runLogFile(Path workspace, long timestamp) {
        return logDirectory(workspace).resolve(timestamp + ".log");
    }

    /**
     * Sets the root level until the returned handle is closed, which restores the previous one.
     */
    public static AutoCloseable applyLevel(LogLevel level) {
        var context = loggerContext();
        if (context == null) {
            return () -> {};
        }
        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        var previous = root.getLevel();
        root.setLevel(toLogback(level));
        return () -> root.setLevel(previous);
    }

    /**
     * Copies the log events of the calling thread into the run's log file until the returned handle is
     * closed. Events are matched on the {@value #RUN_KEY} MDC entry, so concurrent runs keep separate files.
     */
    public static AutoCloseable attach(Path workspace, long timestamp) {
        var context = loggerContext();
        if (context == null) {
            LOG.warn("Logback is not the active SLF4J backend, no run log file for {}", timestamp);
            return () -> {};
        }
        var runId = timestamp + " " + workspace.toAbsolutePath().normalize();
        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        var filter = new Filter<ILoggingEvent>() {
            @Override
            public FilterReply decide(ILoggingEvent event) {
                return runId.equals(event.getMDCPropertyMap().get(RUN_KEY)) ? FilterReply.NEUTRAL : FilterReply.DENY;
            }
        };
        filter.start();

        var appender = new FileAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName("run-" + timestamp + "-" + workspace);
        appender.setFile(runLogFile(workspace, timestamp).toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.addFilter(filter);
        appender.start();

        var previousRun = MDC.get(RUN_KEY);
        MDC.put(RUN_KEY, runId);
        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);
        return () -> {
            root.detachAppender(appender);
            appender.stop();
            if (previousRun == null) {
                MDC.remove(RUN_KEY);
            } else {
                MDC.put(RUN_KEY, previousRun);
            }
        };
    }

    static Level toLogback(LogLevel level) {
        switch (level) {
            case TRACE:
                return Level.TRACE;
            case DEBUG:
                return Level.DEBUG;
            case INFO:
                return Level.INFO;
            case WARN:
                return Level.WARN;
            default:
                return Level.ERROR;
        }
    }

    private static LoggerContext loggerContext() {
        var factory = LoggerFactory.getILoggerFactory();
        return factory instanceof LoggerContext context ? context : null;
    }
}
