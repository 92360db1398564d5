package tech.noetzold.traffic_logger_api;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Puts a set of MDC entries in place for the current thread and, on close,
 * puts back whatever those keys held before.
 */
public final class LoggingScope implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();
    private boolean closed;

    private LoggingScope(Map<String, String> entries) {
        entries.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    public static LoggingScope push(Map<String, String> entries) {
        return new LoggingScope(entries);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}
