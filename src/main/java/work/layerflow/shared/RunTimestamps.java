package work.layerflow.shared;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Run timestamps are plain {@code long} values in {@code yyyyMMddHHmmss} form.
 */
public final class RunTimestamps {
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private RunTimestamps() {}

    public static long now() {
        return of(LocalDateTime.now());
    }

    public static long of(LocalDateTime dateTime) {
        return Long.parseLong(COMPACT.format(dateTime));
    }

    public static LocalDateTime toDateTime(long timestamp) {
        try {
            return LocalDateTime.parse(Long.toString(timestamp), COMPACT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Not a yyyyMMddHHmmss timestamp: " + timestamp, ex);
        }
    }

    public static String display(long timestamp) {
        return DISPLAY.format(toDateTime(timestamp));
    }

    public static String display(LocalDateTime dateTime) {
        return DISPLAY.format(dateTime);
    }
}
