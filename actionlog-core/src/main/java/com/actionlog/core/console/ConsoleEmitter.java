package com.actionlog.core.console;

import com.actionlog.core.model.LogRecord;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Emits records through SLF4J key/value pairs: {@code type}, {@code level}, {@code time} followed
 * by every additional field. Layout is up to the logging backend.
 */
public final class ConsoleEmitter implements LocalEmitter {
    public static final String DEFAULT_LOGGER = "actionlog.console";

    private final Logger log;

    public ConsoleEmitter() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER));
    }

    public ConsoleEmitter(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void emit(LogRecord record) {
        if (record == null) return;
        LoggingEventBuilder event = log.atLevel(record.level().slf4jLevel())
                .addKeyValue("type", record.type())
                .addKeyValue("level", record.level().wireName())
                .addKeyValue("time", DateTimeFormatter.ISO_INSTANT.format(record.timestamp().truncatedTo(ChronoUnit.SECONDS)));
        if (record.error() != null) event = event.addKeyValue("error", record.error());
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            event = event.addKeyValue(field.getKey(), field.getValue());
        }
        event.log(record.message());
    }
}
