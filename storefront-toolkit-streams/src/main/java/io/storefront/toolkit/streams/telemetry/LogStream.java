package io.storefront.toolkit.streams.telemetry;

import io.storefront.toolkit.core.id.EventIds;
import io.storefront.toolkit.streams.channel.StreamChannel;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-process stream of application log entries, for forwarding to live consoles.
 * <p>
 * This is application data, not the toolkit's own diagnostics (those go through SLF4J).
 * The most recent {@code maxLogs} entries are retained for late readers.
 */
public class LogStream {

    public static final int DEFAULT_MAX_LOGS = 1000;

    private final int maxLogs;
    private final Clock clock;
    private final StreamChannel<LogEntry> logs = new StreamChannel<>("logs");

    // Guarded by recent
    private final Deque<LogEntry> recent = new ArrayDeque<>();

    public LogStream(Clock clock) {
        this(DEFAULT_MAX_LOGS, clock);
    }

    public LogStream(int maxLogs, Clock clock) {
        if (maxLogs < 1) {
            throw new IllegalArgumentException("maxLogs must be >= 1, got: " + maxLogs);
        }
        this.maxLogs = maxLogs;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public StreamChannel<LogEntry> logs() {
        return logs;
    }

    public LogEntry debug(String message, Object data) {
        return log(LogLevel.DEBUG, message, data);
    }

    public LogEntry info(String message, Object data) {
        return log(LogLevel.INFO, message, data);
    }

    public LogEntry warn(String message, Object data) {
        return log(LogLevel.WARN, message, data);
    }

    public LogEntry error(String message, Object error) {
        return log(LogLevel.ERROR, message, error);
    }

    public LogEntry log(LogLevel level, String message, Object data) {
        Objects.requireNonNull(level, "level cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        LogEntry entry = new LogEntry(level, message, data, clock.instant(), EventIds.next());
        synchronized (recent) {
            recent.addLast(entry);
            if (recent.size() > maxLogs) {
                recent.removeFirst();
            }
        }
        logs.emit(entry);
        return entry;
    }

    /**
     * @return retained entries, oldest first
     */
    public List<LogEntry> recent() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }
}
